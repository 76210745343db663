/*
 * どこで: チケット連携
 * 何を: 外部チケットトラッカーへの起票/クローズ/担当設定を抽象化する
 * なぜ: Jira 実装とローカル実装を差し替え可能にするため
 */
package com.incidentdesk.incident.client;

public interface TicketTrackerClient {

  /**
   * 起票してチケットキーを返す。
   *
   * @throws IntegrationException 起票できなかった場合
   */
  String createTicket(TicketDraft draft);

  /** クローズできた場合 true。 */
  boolean closeTicket(String ticketKey);

  /** 担当者の設定と着手状態への移行ができた場合 true。 */
  boolean assignTicket(String ticketKey, String assignee);
}
