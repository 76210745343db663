/*
 * どこで: Incident ドメインモデル
 * 何を: チャット上に表示する操作ボタンを定義する
 * なぜ: 状態ごとのボタン構成を純粋関数として表現するため
 */
package com.incidentdesk.incident.model;

public enum IncidentAction {
  TAKE("take_incident", IncidentEvent.TAKE_IN_PROGRESS),
  AWAIT_RESPONSE("awaiting_response", IncidentEvent.AWAIT_RESPONSE),
  CLOSE("close_incident", IncidentEvent.CLOSE),
  FREEZE("freeze_incident", IncidentEvent.FREEZE);

  private final String actionId;
  private final IncidentEvent event;

  IncidentAction(String actionId, IncidentEvent event) {
    this.actionId = actionId;
    this.event = event;
  }

  public String actionId() {
    return actionId;
  }

  public IncidentEvent event() {
    return event;
  }

  public static IncidentAction fromActionId(String actionId) {
    for (IncidentAction action : values()) {
      if (action.actionId.equals(actionId)) {
        return action;
      }
    }
    throw new IllegalArgumentException("unsupported action: " + actionId);
  }
}
