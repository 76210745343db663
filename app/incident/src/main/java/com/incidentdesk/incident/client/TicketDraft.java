/*
 * どこで: チケット連携
 * 何を: 報告メッセージから起票内容(件名/本文)を組み立てる
 * なぜ: トラッカー実装ごとに件名の切り詰め規則がずれないようにするため
 */
package com.incidentdesk.incident.client;

public record TicketDraft(String title, String description, String reporterId, String threadUrl) {

  static final int TITLE_MAX_LENGTH = 150;

  public static TicketDraft fromReport(String text, String reporterId, String threadUrl) {
    final String body = text == null ? "" : text;
    return new TicketDraft(titleOf(body), body, reporterId, threadUrl);
  }

  // 改行は空白にし、上限超過時は末尾に ... を付ける
  static String titleOf(String text) {
    final String flat = text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').strip();
    if (flat.length() <= TITLE_MAX_LENGTH) {
      return flat;
    }
    return flat.substring(0, TITLE_MAX_LENGTH) + "...";
  }

  public String renderDescription() {
    final StringBuilder sb = new StringBuilder();
    sb.append("Incident description:\n").append(description).append("\n\n");
    sb.append("Reported by: ").append(reporterId).append('\n');
    sb.append("Source: chat");
    if (threadUrl != null && !threadUrl.isBlank()) {
      sb.append("\nThread: ").append(threadUrl);
    }
    return sb.toString();
  }
}
