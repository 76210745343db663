/*
 * どこで: Incident ドメインモデル
 * 何を: インシデントのライフサイクル状態を定義する
 * なぜ: DB 永続値と状態遷移表を一貫させるため
 */
package com.incidentdesk.incident.model;

public enum IncidentStatus {
  CREATED,
  ASSIGNED,
  AWAITING_RESPONSE,
  FROZEN,
  CLOSED;

  public boolean isTerminal() {
    return this == CLOSED;
  }
}
