package com.incidentdesk.incident.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "incident.chat.slack")
public record SlackProperties(
    boolean enabled,
    String baseUrl,
    String botToken,
    Duration connectTimeout,
    Duration readTimeout) {

  public SlackProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://slack.com/api" : baseUrl;
    botToken = botToken == null ? "" : botToken;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
