/*
 * どこで: Incident アプリの設定バインド
 * 何を: リマインダー種別ごとの間隔と再構築時の初回遅延を保持する
 * なぜ: 運用で間隔を変更できるようにし、不正値を起動時に弾くため
 */
package com.incidentdesk.incident.config;

import com.incidentdesk.incident.model.ReminderKind;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "incident.reminder")
public record IncidentReminderProperties(
    @Min(1) int defaultIntervalMinutes,
    @Min(1) int awaitingResponseIntervalMinutes,
    @NotNull Duration restoreDelay) {

  @AssertTrue(message = "restoreDelay must not be negative")
  public boolean isRestoreDelayValid() {
    return restoreDelay == null || !restoreDelay.isNegative();
  }

  public int intervalMinutes(ReminderKind kind) {
    return switch (kind) {
      case DEFAULT -> defaultIntervalMinutes;
      case AWAITING_RESPONSE -> awaitingResponseIntervalMinutes;
    };
  }
}
