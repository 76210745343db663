/*
 * どこで: Incident サービス層
 * 何を: リマインダー種別とスナップショットから投稿本文を組み立てる
 * なぜ: default は当番へ、awaiting_response は報告者へと宛先規則を一箇所にまとめるため
 */
package com.incidentdesk.incident.service;

import com.incidentdesk.incident.client.DutyRosterClient;
import com.incidentdesk.incident.model.IncidentSnapshot;
import com.incidentdesk.incident.model.ReminderKind;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReminderMessageComposer {

  private static final Logger logger = LoggerFactory.getLogger(ReminderMessageComposer.class);

  static final String TAKE_INTO_WORK_TEXT = "Please take the incident into work";
  static final String AWAITING_RESPONSE_TEXT = "Waiting for your response";

  private final DutyRosterClient dutyRosterClient;

  /** 宛先を決められない場合は empty。 */
  public Optional<String> compose(ReminderKind kind, IncidentSnapshot snapshot) {
    return switch (kind) {
      case DEFAULT -> composeForDuty(snapshot);
      case AWAITING_RESPONSE -> Optional.of(mention(snapshot.authorId(), AWAITING_RESPONSE_TEXT));
    };
  }

  private Optional<String> composeForDuty(IncidentSnapshot snapshot) {
    final Optional<String> duty = dutyRosterClient.currentResponsible();
    if (duty.isEmpty()) {
      logger.warn("duty person not found; reminder text skipped ticketKey={}",
          snapshot.ticketKey());
      return Optional.empty();
    }
    return Optional.of(mention(duty.get(), TAKE_INTO_WORK_TEXT));
  }

  private String mention(String userId, String text) {
    return "<@" + userId + "> " + text;
  }
}
