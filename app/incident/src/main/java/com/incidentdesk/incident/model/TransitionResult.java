package com.incidentdesk.incident.model;

/**
 * ライフサイクル操作の結果。incident は操作後(または操作を拒否した時点)で把握している最新状態で、NOT_FOUND
 * などでは null になる。
 */
public record TransitionResult(TransitionOutcome outcome, IncidentRecord incident) {

  public static TransitionResult applied(IncidentRecord incident) {
    return new TransitionResult(TransitionOutcome.APPLIED, incident);
  }

  public static TransitionResult notFound() {
    return new TransitionResult(TransitionOutcome.NOT_FOUND, null);
  }

  public static TransitionResult rejected(TransitionOutcome outcome, IncidentRecord current) {
    return new TransitionResult(outcome, current);
  }

  public boolean isApplied() {
    return outcome == TransitionOutcome.APPLIED;
  }
}
