package com.incidentdesk.incident.model;

/** チャットで受け付けた新規報告。threadUrl はチケット本文に載せるリンクで省略可。 */
public record IncidentReport(
    String channelId, String threadTs, String authorId, String text, String threadUrl) {}
