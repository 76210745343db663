/*
 * どこで: Reminder ワーカー
 * 何を: 起動時に、状態上必要なのにリマインダーを持たないアクティブなインシデントへ登録し直す
 * なぜ: キューの消失やスケジュール失敗の後でも催促が止まったままにならないようにするため
 */
package com.incidentdesk.incident.worker;

import com.incidentdesk.incident.config.IncidentReminderProperties;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.IncidentSnapshot;
import com.incidentdesk.incident.model.ReminderKind;
import com.incidentdesk.incident.repository.IncidentRepository;
import com.incidentdesk.incident.service.ReminderScheduler;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "incident.worker.reconcile-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class ReminderReconciler implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(ReminderReconciler.class);

  private final IncidentRepository incidentRepository;
  private final ReminderScheduler reminderScheduler;
  private final IncidentReminderProperties reminderProperties;

  @Override
  public void run(ApplicationArguments args) {
    try {
      reconcile();
    } catch (DataAccessException ex) {
      // 起動は継続する。次回起動時に再度突き合わせる
      logger.error("reminder reconciliation failed", ex);
    }
  }

  /** 登録し直した件数を返す。 */
  public int reconcile() {
    final List<IncidentRecord> active = incidentRepository.findActive();
    int restored = 0;
    for (IncidentRecord incident : active) {
      final Optional<ReminderKind> kind = ReminderKind.impliedBy(incident.status());
      if (kind.isEmpty()) {
        continue;
      }
      if (reminderScheduler.find(incident.ticketKey(), kind.get()).isPresent()) {
        continue;
      }
      reminderScheduler.schedule(
          incident.ticketKey(),
          kind.get(),
          IncidentSnapshot.of(incident),
          reminderProperties.intervalMinutes(kind.get()),
          reminderProperties.restoreDelay());
      restored++;
    }
    logger.info("reminder reconciliation finished active={} restored={}", active.size(), restored);
    return restored;
  }
}
