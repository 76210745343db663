/*
 * どこで: Incident サービス層
 * 何を: 期限到来リマインダーをインシデントの現状と突き合わせ、配信/退役/再登録を行う
 * なぜ: キュー上のスナップショットではなくストアの最新状態を正として催促するため
 */
package com.incidentdesk.incident.service;

import com.google.common.annotations.VisibleForTesting;
import com.incidentdesk.incident.client.ChatClient;
import com.incidentdesk.incident.client.IntegrationException;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.IncidentSnapshot;
import com.incidentdesk.incident.model.IncidentStatus;
import com.incidentdesk.incident.model.ReminderRecord;
import com.incidentdesk.incident.repository.IncidentRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(ReminderDeliveryService.class);

  private final ReminderScheduler reminderScheduler;
  private final IncidentRepository incidentRepository;
  private final ReminderMessageComposer messageComposer;
  private final ChatClient chatClient;
  private final IncidentMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 期限到来分を 1 バッチ処理する。
   * 動作: ストア/キューの障害は呼び出し元へ伝播させる。それ以外の 1 件単位の失敗は記録して次周期へ送り、
   * 残りのリマインダーの処理を続ける。
   */
  public int processDueBatch() {
    final Instant now = Instant.now(clock);
    int processed = 0;
    try (Stream<ReminderRecord> due = reminderScheduler.dueReminders(now)) {
      final Iterator<ReminderRecord> iterator = due.iterator();
      while (iterator.hasNext()) {
        final ReminderRecord reminder = iterator.next();
        try {
          process(reminder, now);
        } catch (DataAccessException ex) {
          throw ex;
        } catch (RuntimeException ex) {
          handleFailure(reminder, ex);
        }
        processed++;
      }
    }
    metrics.updatePendingReminders(reminderScheduler.pendingCount());
    return processed;
  }

  // 失敗した個体を先頭に残すと後続が進まないため、1 周期後ろへ送る
  @VisibleForTesting
  void handleFailure(ReminderRecord reminder, RuntimeException ex) {
    metrics.recordDelivery(reminder.kind(), "failed");
    logger.error("reminder processing failed ticketKey={} kind={}",
        reminder.ticketKey(), reminder.kind().value(), ex);
    reminderScheduler.rescheduleIfCurrent(reminder, reminder.snapshot());
  }

  @VisibleForTesting
  void process(ReminderRecord reminder, Instant now) {
    if (!reminder.isDue(now)) {
      // 取り出し後に期限が延びた。次の tick まで残す
      logger.debug("reminder not yet due ticketKey={} kind={} dueAt={}", reminder.ticketKey(),
          reminder.kind().value(), reminder.dueAt());
      return;
    }
    final Optional<IncidentRecord> found = incidentRepository.findByTicketKey(reminder.ticketKey());
    if (found.isEmpty()) {
      reminderScheduler.retireIfCurrent(reminder);
      metrics.recordDelivery(reminder.kind(), "retired");
      logger.warn("reminder retired; incident missing ticketKey={} kind={}",
          reminder.ticketKey(), reminder.kind().value());
      return;
    }
    final IncidentRecord incident = found.get();
    if (incident.status() == IncidentStatus.CLOSED || incident.status() == IncidentStatus.FROZEN) {
      reminderScheduler.retireIfCurrent(reminder);
      metrics.recordDelivery(reminder.kind(), "retired");
      logger.info("reminder retired ticketKey={} kind={} status={}",
          reminder.ticketKey(), reminder.kind().value(), incident.status());
      return;
    }

    final IncidentSnapshot snapshot = IncidentSnapshot.of(incident);
    deliver(reminder, snapshot, now);

    if (reminder.kind().warrantedBy(incident.status())) {
      reminderScheduler.rescheduleIfCurrent(reminder, snapshot);
    } else {
      reminderScheduler.retireIfCurrent(reminder);
      logger.info("reminder retired after delivery ticketKey={} kind={} status={}",
          reminder.ticketKey(), reminder.kind().value(), incident.status());
    }
  }

  private void deliver(ReminderRecord reminder, IncidentSnapshot snapshot, Instant now) {
    final Optional<String> text = messageComposer.compose(reminder.kind(), snapshot);
    if (text.isEmpty()) {
      metrics.recordDelivery(reminder.kind(), "skipped");
      return;
    }
    try {
      chatClient.postReminder(snapshot.channelId(), snapshot.threadTs(), text.get());
    } catch (IntegrationException ex) {
      metrics.recordDelivery(reminder.kind(), "failed");
      logger.warn("reminder delivery failed ticketKey={} kind={} reason={}",
          reminder.ticketKey(), reminder.kind().value(), ex.reason(), ex);
      return;
    }
    incidentRepository.touchLastNotification(reminder.ticketKey(), now);
    metrics.recordDelivery(reminder.kind(), "sent");
    logger.info("reminder delivered ticketKey={} kind={} status={}",
        reminder.ticketKey(), reminder.kind().value(), snapshot.status());
  }
}
