/*
 * どこで: Incident サービス層
 * 何を: 遷移結果/リマインダー配信結果/ワーカー失敗/保留件数のメトリクスを記録する
 * なぜ: 催促が止まった・競合が多発したといった異常を Prometheus から観測するため
 */
package com.incidentdesk.incident.service;

import com.incidentdesk.incident.model.IncidentEvent;
import com.incidentdesk.incident.model.ReminderKind;
import com.incidentdesk.incident.model.TransitionOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IncidentMetrics {

  private static final String METRIC_TRANSITION_TOTAL = "incident.transition.total";
  private static final String METRIC_REMINDER_DELIVERY_TOTAL = "incident.reminder.delivery.total";
  private static final String METRIC_REMINDER_PENDING = "incident.reminder.pending";
  private static final String METRIC_WORKER_FAILURE_TOTAL = "incident.reminder.worker.failure.total";

  private final MeterRegistry meterRegistry;
  private final AtomicLong pendingReminders = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter workerFailureCounter;

  public IncidentMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_REMINDER_PENDING, pendingReminders, AtomicLong::get)
        .description("Current number of pending reminders")
        .register(meterRegistry);
    this.workerFailureCounter =
        Counter.builder(METRIC_WORKER_FAILURE_TOTAL)
            .description("Total number of failed reminder worker iterations")
            .register(meterRegistry);
  }

  public void recordTransition(IncidentEvent event, TransitionOutcome outcome) {
    counter(
            METRIC_TRANSITION_TOTAL,
            "Incident transition outcomes",
            Tags.of("event", event.value(), "outcome", outcome.name()))
        .increment();
  }

  /** result: sent / failed / skipped / retired */
  public void recordDelivery(ReminderKind kind, String result) {
    counter(
            METRIC_REMINDER_DELIVERY_TOTAL,
            "Reminder delivery outcomes",
            Tags.of("kind", kind.value(), "result", result))
        .increment();
  }

  public void recordWorkerFailure() {
    workerFailureCounter.increment();
  }

  public void updatePendingReminders(long count) {
    pendingReminders.set(Math.max(count, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final String cacheKey = name + tags;
    return counters.computeIfAbsent(
        cacheKey,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
