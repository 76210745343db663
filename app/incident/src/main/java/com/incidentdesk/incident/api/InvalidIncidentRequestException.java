package com.incidentdesk.incident.api;

public class InvalidIncidentRequestException extends RuntimeException {

  public InvalidIncidentRequestException(String message) {
    super(message);
  }
}
