package com.incidentdesk.incident.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SlackPostMessageRequest(
    String channel, @JsonProperty("thread_ts") String threadTs, String text) {}
