/*
 * どこで: Reminder ドメインモデル
 * 何を: リマインダー種別と、それを正当化するインシデント状態を定義する
 * なぜ: Redis キーと Worker の再スケジュール判定を一箇所に固定するため
 */
package com.incidentdesk.incident.model;

import java.util.Optional;

public enum ReminderKind {
  DEFAULT("default", IncidentStatus.CREATED),
  AWAITING_RESPONSE("awaiting_response", IncidentStatus.AWAITING_RESPONSE);

  private final String value;
  private final IncidentStatus remindingStatus;

  ReminderKind(String value, IncidentStatus remindingStatus) {
    this.value = value;
    this.remindingStatus = remindingStatus;
  }

  public String value() {
    return value;
  }

  public boolean warrantedBy(IncidentStatus status) {
    return remindingStatus == status;
  }

  public static Optional<ReminderKind> impliedBy(IncidentStatus status) {
    for (ReminderKind kind : values()) {
      if (kind.remindingStatus == status) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  public static ReminderKind fromValue(String value) {
    for (ReminderKind kind : values()) {
      if (kind.value.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unsupported reminder kind: " + value);
  }
}
