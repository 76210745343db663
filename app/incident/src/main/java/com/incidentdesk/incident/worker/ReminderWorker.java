/*
 * どこで: Reminder ワーカー
 * 何を: スケジュールで期限到来リマインダーの処理を起動する
 * なぜ: 障害時も停止せず、待機を挟んで処理を継続するため
 */
package com.incidentdesk.incident.worker;

import com.incidentdesk.common.TraceIds;
import com.incidentdesk.incident.config.ReminderWorkerProperties;
import com.incidentdesk.incident.service.IncidentMetrics;
import com.incidentdesk.incident.service.ReminderDeliveryService;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "incident.worker.enabled", havingValue = "true", matchIfMissing = true)
public class ReminderWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReminderWorker.class);

  private final ReminderDeliveryService deliveryService;
  private final ReminderWorkerProperties properties;
  private final IncidentMetrics metrics;
  private final Clock clock;

  // スケジューラのスレッドからのみ更新する
  private volatile Instant backoffUntil = Instant.EPOCH;

  @Scheduled(fixedDelayString = "${incident.worker.poll-interval}")
  public void run() {
    final Instant now = Instant.now(clock);
    if (now.isBefore(backoffUntil)) {
      return;
    }
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    try {
      final int processed = deliveryService.processDueBatch();
      if (processed > 0) {
        logger.debug("reminder batch processed count={}", processed);
      }
    } catch (RuntimeException ex) {
      backoffUntil = now.plus(properties.failureBackoff());
      metrics.recordWorkerFailure();
      logger.warn("reminder worker iteration failed; backing off until={}", backoffUntil, ex);
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  Instant backoffUntil() {
    return backoffUntil;
  }
}
