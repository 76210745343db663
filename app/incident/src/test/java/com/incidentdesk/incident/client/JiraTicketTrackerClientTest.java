package com.incidentdesk.incident.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.HttpMethod.PUT;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.incidentdesk.incident.config.JiraProperties;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class JiraTicketTrackerClientTest {

  @Test
  void createTicketPostsIssueAndReturnsKey() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.fields.project.key").value("OPS"))
        .andExpect(jsonPath("$.fields.summary").value("db is down"))
        .andExpect(jsonPath("$.fields.issuetype.name").value("Incident"))
        .andRespond(
            withSuccess(
                """
                {"id":"10001","key":"OPS-7","self":"http://jira.test/rest/api/2/issue/10001"}
                """,
                MediaType.APPLICATION_JSON));

    final String ticketKey =
        fixture.client.createTicket(TicketDraft.fromReport("db is down", "U-AUTHOR", null));

    assertThat(ticketKey).isEqualTo("OPS-7");
    fixture.server.verify();
  }

  @Test
  void createTicketMapsServerErrorToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue"))
        .andRespond(withServerError());

    assertThatThrownBy(
            () -> fixture.client.createTicket(TicketDraft.fromReport("x", "U-AUTHOR", null)))
        .isInstanceOf(IntegrationException.class)
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void createTicketMapsTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(
            () -> fixture.client.createTicket(TicketDraft.fromReport("x", "U-AUTHOR", null)))
        .isInstanceOf(IntegrationException.class)
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.TIMEOUT);
  }

  @Test
  void createTicketRejectsResponseWithoutKey() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue"))
        .andRespond(withSuccess("{\"id\":\"10001\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(
            () -> fixture.client.createTicket(TicketDraft.fromReport("x", "U-AUTHOR", null)))
        .isInstanceOf(IntegrationException.class)
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void closeTicketTransitionsToDone() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue/OPS-7/transitions"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.transition.id").value("91"))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    assertThat(fixture.client.closeTicket("OPS-7")).isTrue();
    fixture.server.verify();
  }

  @Test
  void closeTicketReturnsFalseWhenJiraRejects() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue/OPS-7/transitions"))
        .andRespond(withStatus(HttpStatus.BAD_REQUEST));

    assertThat(fixture.client.closeTicket("OPS-7")).isFalse();
  }

  @Test
  void assignTicketPicksExactEmailMatchAndMovesToInProgress() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/user/search?query=ops@example.com"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                [
                  {"accountId":"acc-1","emailAddress":"ops-team@example.com"},
                  {"accountId":"acc-2","emailAddress":"Ops@Example.com"}
                ]
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue/OPS-7/assignee"))
        .andExpect(method(PUT))
        .andExpect(jsonPath("$.accountId").value("acc-2"))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue/OPS-7/transitions"))
        .andExpect(jsonPath("$.transition.id").value("111"))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    assertThat(fixture.client.assignTicket("OPS-7", "ops@example.com")).isTrue();
    fixture.server.verify();
  }

  @Test
  void assignTicketSkipsWhenUserIsUnknown() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/user/search?query=nobody"))
        .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.assignTicket("OPS-7", "nobody")).isFalse();
    fixture.server.verify();
  }

  @Test
  void assignTicketSkipsWhenUserSearchReturnsHtml() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/user/search?query=ops@example.com"))
        .andRespond(withSuccess("<html><body>Log in</body></html>", MediaType.TEXT_HTML));

    assertThat(fixture.client.assignTicket("OPS-7", "ops@example.com")).isFalse();
    fixture.server.verify();
  }

  @Test
  void createTicketMapsHtmlBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://jira.test/rest/api/2/issue"))
        .andRespond(withSuccess("<html><body>Log in</body></html>", MediaType.TEXT_HTML));

    assertThatThrownBy(
            () -> fixture.client.createTicket(TicketDraft.fromReport("x", "U-AUTHOR", null)))
        .isInstanceOf(IntegrationException.class)
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.INVALID_RESPONSE);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://jira.test").build();
    final JiraProperties properties =
        new JiraProperties(
            true, "http://jira.test", "bot", "token", "OPS", null, null, null, null, null);
    return new ClientFixture(new JiraTicketTrackerClient(restClient, properties), server);
  }

  private record ClientFixture(JiraTicketTrackerClient client, MockRestServiceServer server) {}
}
