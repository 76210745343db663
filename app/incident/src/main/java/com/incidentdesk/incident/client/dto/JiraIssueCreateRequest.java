package com.incidentdesk.incident.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JiraIssueCreateRequest(Fields fields) {

  public static JiraIssueCreateRequest of(
      String projectKey, String summary, String description, String issueType) {
    return new JiraIssueCreateRequest(
        new Fields(new Key(projectKey), summary, description, new Name(issueType)));
  }

  public record Fields(
      Key project, String summary, String description, @JsonProperty("issuetype") Name issueType) {}

  public record Key(String key) {}

  public record Name(String name) {}
}
