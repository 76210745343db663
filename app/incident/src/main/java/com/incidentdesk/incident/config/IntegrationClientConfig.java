package com.incidentdesk.incident.config;

import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class IntegrationClientConfig {

  @Bean
  @ConditionalOnProperty(name = "incident.tracker.jira.enabled", havingValue = "true")
  RestClient jiraRestClient(RestClient.Builder builder, JiraProperties properties) {
    // Jira 呼び出し専用 RestClient。Basic 認証は API トークンを使う
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .defaultHeaders(
            headers -> {
              headers.setBasicAuth(properties.username(), properties.apiToken());
              headers.setContentType(MediaType.APPLICATION_JSON);
            })
        .build();
  }

  @Bean
  @ConditionalOnProperty(name = "incident.chat.slack.enabled", havingValue = "true")
  RestClient slackRestClient(RestClient.Builder builder, SlackProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.botToken())
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }

  // 外部呼び出しは必ずタイムアウトで打ち切る
  private SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
