/*
 * どこで: Incident ドメインモデル
 * 何を: ライフサイクル操作の結果分類を定義する
 * なぜ: 想定内の失敗(競合/不正遷移)を例外ではなく値で扱うため
 */
package com.incidentdesk.incident.model;

public enum TransitionOutcome {
  APPLIED,
  NOT_FOUND,
  INVALID_TRANSITION,
  CONFLICT,
  ADAPTER_FAILURE,
  DUPLICATE;

  /** 「既に処理済み」としてユーザーに返すべき結果か。 */
  public boolean alreadyHandled() {
    return this == INVALID_TRANSITION || this == CONFLICT;
  }
}
