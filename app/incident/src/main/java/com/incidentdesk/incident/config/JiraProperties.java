package com.incidentdesk.incident.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "incident.tracker.jira")
public record JiraProperties(
    boolean enabled,
    String baseUrl,
    String username,
    String apiToken,
    String projectKey,
    String issueType,
    String closeTransitionId,
    String inProgressTransitionId,
    Duration connectTimeout,
    Duration readTimeout) {

  public JiraProperties {
    baseUrl = baseUrl == null ? "http://localhost:8081" : baseUrl;
    username = username == null ? "" : username;
    apiToken = apiToken == null ? "" : apiToken;
    projectKey = projectKey == null || projectKey.isBlank() ? "INC" : projectKey;
    issueType = issueType == null || issueType.isBlank() ? "Incident" : issueType;
    closeTransitionId =
        closeTransitionId == null || closeTransitionId.isBlank() ? "91" : closeTransitionId;
    inProgressTransitionId =
        inProgressTransitionId == null || inProgressTransitionId.isBlank()
            ? "111"
            : inProgressTransitionId;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
