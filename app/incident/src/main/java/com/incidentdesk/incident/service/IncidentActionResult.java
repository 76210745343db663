package com.incidentdesk.incident.service;

import com.incidentdesk.incident.model.IncidentAction;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.TransitionOutcome;
import java.util.List;

/**
 * ボタン操作の結果。permitted=false のとき outcome は null。controls は操作後に把握している状態のボタン構成で、
 * 拒否時も UI を元に戻すために返す。
 */
public record IncidentActionResult(
    boolean permitted,
    TransitionOutcome outcome,
    IncidentRecord incident,
    List<IncidentAction> controls) {

  public IncidentActionResult {
    controls = controls == null ? List.of() : List.copyOf(controls);
  }
}
