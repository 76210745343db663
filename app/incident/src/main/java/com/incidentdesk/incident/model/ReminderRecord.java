/*
 * どこで: Reminder ドメインモデル
 * 何を: (ticketKey, kind) ごとに高々 1 件存在する保留中リマインダーを表す
 * なぜ: Scheduler と Worker 間で受け渡す構造を固定するため
 */
package com.incidentdesk.incident.model;

import java.time.Duration;
import java.time.Instant;

public record ReminderRecord(
    String ticketKey,
    ReminderKind kind,
    String token,
    Instant dueAt,
    int intervalMinutes,
    IncidentSnapshot snapshot,
    Instant createdAt) {

  public boolean isDue(Instant now) {
    return !dueAt.isAfter(now);
  }

  public Duration interval() {
    return Duration.ofMinutes(intervalMinutes);
  }
}
