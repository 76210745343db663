package com.incidentdesk.incident.client.dto;

public record JiraAssigneeRequest(String accountId) {}
