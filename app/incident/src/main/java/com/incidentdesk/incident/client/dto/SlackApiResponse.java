package com.incidentdesk.incident.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackApiResponse(boolean ok, String error, String ts) {}
