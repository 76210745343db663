package com.incidentdesk.incident.client;

public class IntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public IntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
