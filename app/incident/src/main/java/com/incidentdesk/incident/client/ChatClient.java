/*
 * どこで: チャット連携
 * 何を: インシデントスレッドへの投稿とユーザー情報の参照を抽象化するインターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.incidentdesk.incident.client;

import java.util.Optional;

public interface ChatClient {

  /** 失敗時は IntegrationException を送出する。 */
  void postReminder(String channelId, String threadTs, String text);

  /** チャット上のユーザー ID からメールアドレスを引く。登録がなければ empty。 */
  Optional<String> findUserEmail(String userId);
}
