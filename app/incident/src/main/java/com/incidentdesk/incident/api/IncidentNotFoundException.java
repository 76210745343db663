package com.incidentdesk.incident.api;

public class IncidentNotFoundException extends RuntimeException {

  public IncidentNotFoundException(String ticketKey) {
    super("incident not found: " + ticketKey);
  }
}
