/*
 * どこで: Reminder ドメインモデル
 * 何を: リマインダー本文の組み立てに必要なインシデント項目の非正規化コピー
 * なぜ: 配信時にストアを読まずともメッセージを構成できるようにするため
 */
package com.incidentdesk.incident.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record IncidentSnapshot(
    @JsonProperty("ticket_key") String ticketKey,
    @JsonProperty("channel_id") String channelId,
    @JsonProperty("thread_ts") String threadTs,
    @JsonProperty("author_id") String authorId,
    @JsonProperty("assigned_to") String assignedTo,
    @JsonProperty("status") IncidentStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_notification") Instant lastNotification) {

  public static IncidentSnapshot of(IncidentRecord incident) {
    return new IncidentSnapshot(
        incident.ticketKey(),
        incident.channelId(),
        incident.threadTs(),
        incident.authorId(),
        incident.assignedTo(),
        incident.status(),
        incident.createdAt(),
        incident.lastNotification());
  }
}
