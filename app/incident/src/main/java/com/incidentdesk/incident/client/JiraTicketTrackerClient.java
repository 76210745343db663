/*
 * どこで: チケット連携
 * 何を: Jira REST API でインシデントチケットを起票/クローズ/担当設定する
 * なぜ: インシデントの正本をチケットトラッカー側にも残すため
 */
package com.incidentdesk.incident.client;

import com.incidentdesk.incident.client.dto.JiraAssigneeRequest;
import com.incidentdesk.incident.client.dto.JiraIssueCreateRequest;
import com.incidentdesk.incident.client.dto.JiraIssueCreateResponse;
import com.incidentdesk.incident.client.dto.JiraTransitionRequest;
import com.incidentdesk.incident.client.dto.JiraUser;
import com.incidentdesk.incident.config.JiraProperties;
import java.util.Arrays;
import java.util.Locale;
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
@ConditionalOnProperty(name = "incident.tracker.jira.enabled", havingValue = "true")
public class JiraTicketTrackerClient implements TicketTrackerClient {

  private static final Logger logger = LoggerFactory.getLogger(JiraTicketTrackerClient.class);
  private static final String SYSTEM = "jira";

  private final RestClient jiraRestClient;
  private final JiraProperties properties;

  public JiraTicketTrackerClient(
      @Qualifier("jiraRestClient") RestClient jiraRestClient, JiraProperties properties) {
    this.jiraRestClient = jiraRestClient;
    this.properties = properties;
  }

  @Override
  public String createTicket(TicketDraft draft) {
    final JiraIssueCreateRequest request =
        JiraIssueCreateRequest.of(
            properties.projectKey(),
            draft.title(),
            draft.renderDescription(),
            properties.issueType());
    final JiraIssueCreateResponse response =
        call(
            () ->
                jiraRestClient
                    .post()
                    .uri("/rest/api/2/issue")
                    .body(request)
                    .retrieve()
                    .body(JiraIssueCreateResponse.class));
    if (response == null || response.key() == null || response.key().isBlank()) {
      throw IntegrationErrors.invalidResponse(SYSTEM, "issue key missing");
    }
    logger.info("jira ticket created ticketKey={}", response.key());
    return response.key();
  }

  @Override
  public boolean closeTicket(String ticketKey) {
    try {
      transition(ticketKey, properties.closeTransitionId());
      logger.info("jira ticket closed ticketKey={}", ticketKey);
      return true;
    } catch (IntegrationException ex) {
      logger.warn("jira ticket close failed ticketKey={} reason={}", ticketKey, ex.reason(), ex);
      return false;
    }
  }

  @Override
  public boolean assignTicket(String ticketKey, String assignee) {
    try {
      final Optional<String> accountId = findAccountId(assignee);
      if (accountId.isEmpty()) {
        logger.warn("jira user not found; assignment skipped ticketKey={} assignee={}",
            ticketKey, assignee);
        return false;
      }
      call(
          () ->
              jiraRestClient
                  .put()
                  .uri("/rest/api/2/issue/{ticketKey}/assignee", ticketKey)
                  .body(new JiraAssigneeRequest(accountId.get()))
                  .retrieve()
                  .toBodilessEntity());
      transition(ticketKey, properties.inProgressTransitionId());
      logger.info("jira ticket assigned ticketKey={} accountId={}", ticketKey, accountId.get());
      return true;
    } catch (IntegrationException ex) {
      logger.warn("jira ticket assign failed ticketKey={} reason={}", ticketKey, ex.reason(), ex);
      return false;
    }
  }

  // 検索結果が 1 件ならそれを、複数ならメールアドレスの完全一致を採用する
  private Optional<String> findAccountId(String query) {
    final JiraUser[] users =
        call(
            () ->
                jiraRestClient
                    .get()
                    .uri("/rest/api/2/user/search?query={query}", query)
                    .retrieve()
                    .body(JiraUser[].class));
    if (users == null || users.length == 0) {
      return Optional.empty();
    }
    if (users.length == 1) {
      return Optional.ofNullable(users[0].accountId());
    }
    final String normalized = query.toLowerCase(Locale.ROOT);
    return Arrays.stream(users)
        .filter(u -> u.emailAddress() != null)
        .filter(u -> u.emailAddress().toLowerCase(Locale.ROOT).equals(normalized))
        .map(JiraUser::accountId)
        .findFirst();
  }

  private void transition(String ticketKey, String transitionId) {
    call(
        () ->
            jiraRestClient
                .post()
                .uri("/rest/api/2/issue/{ticketKey}/transitions", ticketKey)
                .body(JiraTransitionRequest.of(transitionId))
                .retrieve()
                .toBodilessEntity());
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
