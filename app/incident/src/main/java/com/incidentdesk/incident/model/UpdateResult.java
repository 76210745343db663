/*
 * どこで: Incident ドメインモデル
 * 何を: compare-and-set 更新の結果を表す
 * なぜ: 競合を例外ではなく値として呼び出し側へ返すため
 */
package com.incidentdesk.incident.model;

public enum UpdateResult {
  UPDATED,
  CONFLICT
}
