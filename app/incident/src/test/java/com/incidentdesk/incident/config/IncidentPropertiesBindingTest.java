/*
 * どこで: Incident 設定バインドのテスト
 * 何を: リマインダー/ワーカー/当番表設定のバインドと起動時バリデーションを検証する
 * なぜ: 間隔 0 などの不正設定でワーカーが暴走する前に起動を止めるため
 */
package com.incidentdesk.incident.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.incidentdesk.incident.model.ReminderKind;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class IncidentPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "incident.reminder.default-interval-minutes=15",
              "incident.reminder.awaiting-response-interval-minutes=60",
              "incident.reminder.restore-delay=30s",
              "incident.worker.enabled=true",
              "incident.worker.poll-interval=5s",
              "incident.worker.batch-size=100",
              "incident.worker.failure-backoff=30s",
              "incident.worker.reconcile-on-startup=true",
              "incident.duty.zone=Europe/Moscow",
              "incident.duty.fallback-user-id=U-FALLBACK",
              "incident.duty.shifts[0].name=week-10",
              "incident.duty.shifts[0].user-id=U-ALICE",
              "incident.duty.shifts[0].start-date=2026-03-02",
              "incident.duty.shifts[0].end-date=2026-03-08");

  @Test
  void contextStartsAndBindsAllIncidentProperties() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final IncidentReminderProperties reminder =
              context.getBean(IncidentReminderProperties.class);
          final ReminderWorkerProperties worker = context.getBean(ReminderWorkerProperties.class);
          final DutyRosterProperties duty = context.getBean(DutyRosterProperties.class);

          assertThat(reminder.intervalMinutes(ReminderKind.DEFAULT)).isEqualTo(15);
          assertThat(reminder.intervalMinutes(ReminderKind.AWAITING_RESPONSE)).isEqualTo(60);
          assertThat(reminder.restoreDelay()).isEqualTo(Duration.ofSeconds(30));
          assertThat(worker.pollInterval()).isEqualTo(Duration.ofSeconds(5));
          assertThat(worker.batchSize()).isEqualTo(100);
          assertThat(worker.failureBackoff()).isEqualTo(Duration.ofSeconds(30));
          assertThat(duty.zone()).isEqualTo(ZoneId.of("Europe/Moscow"));
          assertThat(duty.shifts()).hasSize(1);
          assertThat(duty.shifts().get(0).covers(LocalDate.parse("2026-03-08"))).isTrue();
          assertThat(duty.shifts().get(0).covers(LocalDate.parse("2026-03-09"))).isFalse();
        });
  }

  @Test
  void zeroReminderIntervalFailsStartup() {
    contextRunner
        .withPropertyValues("incident.reminder.default-interval-minutes=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void zeroPollIntervalFailsStartup() {
    contextRunner
        .withPropertyValues("incident.worker.poll-interval=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void shiftEndingBeforeStartFailsStartup() {
    contextRunner
        .withPropertyValues("incident.duty.shifts[0].end-date=2026-03-01")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    IncidentReminderProperties.class,
    ReminderWorkerProperties.class,
    DutyRosterProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
