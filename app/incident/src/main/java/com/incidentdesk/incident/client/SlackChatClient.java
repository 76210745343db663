/*
 * どこで: チャット連携
 * 何を: Slack Web API の chat.postMessage でスレッドへ投稿し、users.info でメールアドレスを引く
 * なぜ: リマインダーを元の報告スレッドに届け、担当者をトラッカー側のユーザーへ対応付けるため
 */
package com.incidentdesk.incident.client;

import com.incidentdesk.incident.client.dto.SlackApiResponse;
import com.incidentdesk.incident.client.dto.SlackPostMessageRequest;
import com.incidentdesk.incident.client.dto.SlackUserInfoResponse;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "incident.chat.slack.enabled", havingValue = "true")
public class SlackChatClient implements ChatClient {

  private static final Logger logger = LoggerFactory.getLogger(SlackChatClient.class);
  private static final String SYSTEM = "slack";

  private final RestClient slackRestClient;

  public SlackChatClient(@Qualifier("slackRestClient") RestClient slackRestClient) {
    this.slackRestClient = slackRestClient;
  }

  @Override
  public void postReminder(String channelId, String threadTs, String text) {
    final SlackApiResponse response =
        call(
            () ->
                slackRestClient
                    .post()
                    .uri("/chat.postMessage")
                    .body(new SlackPostMessageRequest(channelId, threadTs, text))
                    .retrieve()
                    .body(SlackApiResponse.class));
    // Slack はアプリケーションエラーも HTTP 200 で返す
    if (response == null) {
      throw IntegrationErrors.invalidResponse(SYSTEM, "empty body");
    }
    if (!response.ok()) {
      throw IntegrationErrors.invalidResponse(SYSTEM, String.valueOf(response.error()));
    }
    logger.debug("slack message posted channelId={} threadTs={} ts={}", channelId, threadTs,
        response.ts());
  }

  @Override
  public Optional<String> findUserEmail(String userId) {
    final SlackUserInfoResponse response =
        call(
            () ->
                slackRestClient
                    .get()
                    .uri("/users.info?user={userId}", userId)
                    .retrieve()
                    .body(SlackUserInfoResponse.class));
    if (response == null) {
      throw IntegrationErrors.invalidResponse(SYSTEM, "empty body");
    }
    if (!response.ok()) {
      if ("user_not_found".equals(response.error())) {
        return Optional.empty();
      }
      throw IntegrationErrors.invalidResponse(SYSTEM, String.valueOf(response.error()));
    }
    if (response.user() == null || response.user().profile() == null) {
      return Optional.empty();
    }
    final String email = response.user().profile().email();
    return email == null || email.isBlank() ? Optional.empty() : Optional.of(email);
  }

  private <T> T call(Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw IntegrationErrors.fromResponse(SYSTEM, ex);
    } catch (ResourceAccessException ex) {
      throw IntegrationErrors.fromResourceAccess(SYSTEM, ex);
    } catch (RuntimeException ex) {
      throw IntegrationErrors.unreadable(SYSTEM, ex);
    }
  }
}
