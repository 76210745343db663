package com.incidentdesk.incident.service;

import com.incidentdesk.incident.model.IncidentAction;
import com.incidentdesk.incident.model.IncidentStatus;
import java.util.Arrays;
import java.util.List;

/** 状態ごとにスレッドへ表示する操作ボタン。状態だけで決まり、遷移表で許可される操作だけを出す。 */
public final class IncidentControls {

  private IncidentControls() {}

  public static List<IncidentAction> forStatus(IncidentStatus status) {
    return Arrays.stream(IncidentAction.values())
        .filter(action -> IncidentTransitions.isAllowed(status, action.event()))
        .toList();
  }
}
