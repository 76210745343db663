package com.incidentdesk.incident.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.incidentdesk.incident.model.IncidentAction;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.service.IncidentControls;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、防御的コピーを行わないため")
public record IncidentResponse(
    String ticketKey,
    String channelId,
    String threadTs,
    String authorId,
    String assignedTo,
    String status,
    String createdAt,
    String lastNotification,
    List<String> controls) {

  public static IncidentResponse from(IncidentRecord incident) {
    return new IncidentResponse(
        incident.ticketKey(),
        incident.channelId(),
        incident.threadTs(),
        incident.authorId(),
        incident.assignedTo(),
        incident.status().name(),
        incident.createdAt() == null ? null : incident.createdAt().toString(),
        incident.lastNotification() == null ? null : incident.lastNotification().toString(),
        actionIds(IncidentControls.forStatus(incident.status())));
  }

  public static List<String> actionIds(List<IncidentAction> actions) {
    return actions.stream().map(IncidentAction::actionId).toList();
  }
}
