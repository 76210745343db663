/*
 * どこで: Incident サービス層
 * 何を: チャットのボタン操作を権限確認のうえライフサイクルへ渡す
 * なぜ: 権限のない操作を状態遷移の前に止め、どの結果でも現状に合ったボタンを返すため
 */
package com.incidentdesk.incident.service;

import com.incidentdesk.incident.config.IncidentAccessProperties;
import com.incidentdesk.incident.model.IncidentAction;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.TransitionOutcome;
import com.incidentdesk.incident.model.TransitionResult;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IncidentActionService {

  private static final Logger logger = LoggerFactory.getLogger(IncidentActionService.class);

  private final IncidentLifecycleService lifecycleService;
  private final IncidentAccessProperties accessProperties;

  public IncidentActionResult handle(String ticketKey, IncidentAction action, String actorId) {
    if (!accessProperties.isActorAllowed(actorId)) {
      logger.warn(
          "incident action denied ticketKey={} action={} actorId={}",
          ticketKey,
          action.actionId(),
          actorId);
      final Optional<IncidentRecord> current = lifecycleService.find(ticketKey);
      return new IncidentActionResult(
          false, null, current.orElse(null), controlsOf(current.orElse(null)));
    }
    final TransitionResult result = lifecycleService.apply(ticketKey, action.event(), actorId);
    return new IncidentActionResult(
        true, result.outcome(), result.incident(), controlsOf(result.incident()));
  }

  public boolean isActorAllowed(String actorId) {
    return accessProperties.isActorAllowed(actorId);
  }

  public boolean isChannelAllowed(String channelId) {
    return accessProperties.isChannelAllowed(channelId);
  }

  /** 報告への応答に添えるボタン。 */
  public List<IncidentAction> controlsFor(TransitionResult result) {
    if (result.outcome() == TransitionOutcome.NOT_FOUND) {
      return List.of();
    }
    return controlsOf(result.incident());
  }

  private List<IncidentAction> controlsOf(IncidentRecord incident) {
    return incident == null ? List.of() : IncidentControls.forStatus(incident.status());
  }
}
