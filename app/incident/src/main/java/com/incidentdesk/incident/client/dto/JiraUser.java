package com.incidentdesk.incident.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraUser(String accountId, String emailAddress, String displayName) {}
