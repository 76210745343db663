/*
 * どこで: Incident アプリの設定バインド
 * 何を: リマインダーワーカーのポーリング/障害時待機設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.incidentdesk.incident.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "incident.worker")
public record ReminderWorkerProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Min(1) int batchSize,
    @NotNull Duration failureBackoff,
    boolean reconcileOnStartup) {

  @AssertTrue(message = "pollInterval must be positive")
  public boolean isPollIntervalValid() {
    return pollInterval == null || (!pollInterval.isZero() && !pollInterval.isNegative());
  }

  @AssertTrue(message = "failureBackoff must not be negative")
  public boolean isFailureBackoffValid() {
    return failureBackoff == null || !failureBackoff.isNegative();
  }
}
