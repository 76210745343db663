/*
 * どこで: Incident ドメインモデル
 * 何を: 状態遷移を引き起こす操作を定義する
 * なぜ: ボタン操作とスレッド返信を同じ遷移表で扱うため
 */
package com.incidentdesk.incident.model;

public enum IncidentEvent {
  TAKE_IN_PROGRESS("take"),
  AWAIT_RESPONSE("await"),
  REPLY_RECEIVED("reply"),
  CLOSE("close"),
  FREEZE("freeze");

  private final String value;

  IncidentEvent(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: API で受け取った action 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static IncidentEvent fromValue(String action) {
    for (IncidentEvent event : values()) {
      if (event.value.equalsIgnoreCase(action)) {
        return event;
      }
    }
    throw new IllegalArgumentException("unsupported action: " + action);
  }
}
