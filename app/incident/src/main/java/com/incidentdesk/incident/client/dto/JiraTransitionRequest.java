package com.incidentdesk.incident.client.dto;

public record JiraTransitionRequest(Transition transition) {

  public static JiraTransitionRequest of(String transitionId) {
    return new JiraTransitionRequest(new Transition(transitionId));
  }

  public record Transition(String id) {}
}
