package com.incidentdesk.incident.client;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TicketDraftTest {

  @Test
  void shortTitleIsKeptAsIs() {
    assertThat(TicketDraft.titleOf("payments are failing")).isEqualTo("payments are failing");
  }

  @Test
  void newlinesAreFlattened() {
    assertThat(TicketDraft.titleOf("first\nsecond\r\nthird")).isEqualTo("first second third");
  }

  @Test
  void longTitleIsTruncatedWithEllipsis() {
    final String text = "a".repeat(200);

    final String title = TicketDraft.titleOf(text);

    assertThat(title).hasSize(TicketDraft.TITLE_MAX_LENGTH + 3).endsWith("...");
  }

  @Test
  void descriptionCarriesReporterAndThreadLink() {
    final TicketDraft draft =
        TicketDraft.fromReport("db is down", "U-AUTHOR", "https://chat.example/t/1");

    assertThat(draft.renderDescription())
        .contains("db is down")
        .contains("Reported by: U-AUTHOR")
        .contains("Thread: https://chat.example/t/1");
  }
}
