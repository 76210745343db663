/*
 * どこで: チケット連携
 * 何を: 外部トラッカーを使わずにチケットキーを採番する実装
 * なぜ: Jira なしでライフサイクル全体を動かすため
 */
package com.incidentdesk.incident.client;

import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "incident.tracker.jira.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LocalTicketTrackerClient implements TicketTrackerClient {

  private static final Logger logger = LoggerFactory.getLogger(LocalTicketTrackerClient.class);
  private static final String KEY_PREFIX = "LOCAL-";

  @Override
  public String createTicket(TicketDraft draft) {
    // 再起動後も既存キーと衝突しないよう乱数で採番する
    final String ticketKey =
        KEY_PREFIX + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
    logger.info("ticket simulated create ticketKey={} title={}", ticketKey, draft.title());
    return ticketKey;
  }

  @Override
  public boolean closeTicket(String ticketKey) {
    logger.info("ticket simulated close ticketKey={}", ticketKey);
    return true;
  }

  @Override
  public boolean assignTicket(String ticketKey, String assignee) {
    logger.info("ticket simulated assign ticketKey={} assignee={}", ticketKey, assignee);
    return true;
  }
}
