/*
 * どこで: Incident ドメインモデル
 * 何を: incidents テーブルのスナップショットを表す
 * なぜ: Repository/Lifecycle/Worker 間で受け渡す構造を固定するため
 */
package com.incidentdesk.incident.model;

import java.time.Instant;

public record IncidentRecord(
    String ticketKey,
    String channelId,
    String threadTs,
    String authorId,
    String assignedTo,
    IncidentStatus status,
    Instant createdAt,
    Instant lastNotification) {

  public static IncidentRecord created(
      String ticketKey, String channelId, String threadTs, String authorId, Instant now) {
    return new IncidentRecord(
        ticketKey, channelId, threadTs, authorId, null, IncidentStatus.CREATED, now, null);
  }

  public IncidentRecord withStatus(IncidentStatus nextStatus) {
    return new IncidentRecord(
        ticketKey, channelId, threadTs, authorId, assignedTo, nextStatus, createdAt,
        lastNotification);
  }

  public IncidentRecord withAssignment(String assignee, IncidentStatus nextStatus) {
    return new IncidentRecord(
        ticketKey, channelId, threadTs, authorId, assignee, nextStatus, createdAt,
        lastNotification);
  }
}
