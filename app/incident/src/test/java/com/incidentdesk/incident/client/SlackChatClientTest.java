package com.incidentdesk.incident.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class SlackChatClientTest {

  @Test
  void postReminderSendsThreadReply() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/chat.postMessage"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.channel").value("C1"))
        .andExpect(jsonPath("$.thread_ts").value("100.1"))
        .andExpect(jsonPath("$.text").value("<@U1> Waiting for your response"))
        .andRespond(
            withSuccess("{\"ok\":true,\"ts\":\"100.2\"}", MediaType.APPLICATION_JSON));

    assertThatCode(
            () -> fixture.client.postReminder("C1", "100.1", "<@U1> Waiting for your response"))
        .doesNotThrowAnyException();
    fixture.server.verify();
  }

  @Test
  void postReminderFailsWhenSlackReportsError() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/chat.postMessage"))
        .andRespond(
            withSuccess(
                "{\"ok\":false,\"error\":\"channel_not_found\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.postReminder("C404", "1.1", "text"))
        .isInstanceOf(IntegrationException.class)
        .hasMessageContaining("channel_not_found")
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void postReminderMapsUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/chat.postMessage"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> fixture.client.postReminder("C1", "1.1", "text"))
        .isInstanceOf(IntegrationException.class)
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.UNAUTHORIZED);
  }

  @Test
  void postReminderMapsHtmlBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/chat.postMessage"))
        .andRespond(withSuccess("<html><body>Sign in</body></html>", MediaType.TEXT_HTML));

    assertThatThrownBy(() -> fixture.client.postReminder("C1", "1.1", "text"))
        .isInstanceOf(IntegrationException.class)
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void findUserEmailReadsProfileEmail() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/users.info?user=U1"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                "{\"ok\":true,\"user\":{\"id\":\"U1\",\"profile\":"
                    + "{\"email\":\"oncall@example.com\",\"real_name\":\"On Call\"}}}",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findUserEmail("U1")).contains("oncall@example.com");
    fixture.server.verify();
  }

  @Test
  void findUserEmailIsEmptyForUnknownUser() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/users.info?user=U404"))
        .andRespond(
            withSuccess(
                "{\"ok\":false,\"error\":\"user_not_found\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findUserEmail("U404")).isEmpty();
  }

  @Test
  void findUserEmailIsEmptyWhenProfileHidesEmail() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/users.info?user=U2"))
        .andRespond(
            withSuccess(
                "{\"ok\":true,\"user\":{\"id\":\"U2\",\"profile\":{}}}",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findUserEmail("U2")).isEmpty();
  }

  @Test
  void findUserEmailMapsHtmlBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://slack.test/api/users.info?user=U1"))
        .andRespond(withSuccess("<html>maintenance</html>", MediaType.TEXT_HTML));

    assertThatThrownBy(() -> fixture.client.findUserEmail("U1"))
        .isInstanceOf(IntegrationException.class)
        .extracting(ex -> ((IntegrationException) ex).reason())
        .isEqualTo(IntegrationException.Reason.INVALID_RESPONSE);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://slack.test/api").build();
    return new ClientFixture(new SlackChatClient(restClient), server);
  }

  private record ClientFixture(SlackChatClient client, MockRestServiceServer server) {}
}
