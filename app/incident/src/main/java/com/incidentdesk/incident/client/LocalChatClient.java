/*
 * どこで: チャット連携
 * 何を: 投稿を模擬する実装
 * なぜ: Slack 資格情報なしでリマインダーの流れを確認するため
 */
package com.incidentdesk.incident.client;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "incident.chat.slack.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LocalChatClient implements ChatClient {

  private static final Logger logger = LoggerFactory.getLogger(LocalChatClient.class);

  @Override
  public void postReminder(String channelId, String threadTs, String text) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "chat message simulated channelId={} threadTs={} text={}", channelId, threadTs, text);
  }

  @Override
  public Optional<String> findUserEmail(String userId) {
    // ディレクトリを持たないため常に未解決
    logger.debug("chat user lookup simulated userId={}", userId);
    return Optional.empty();
  }
}
