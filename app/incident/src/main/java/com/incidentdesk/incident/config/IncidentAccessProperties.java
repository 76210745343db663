/*
 * どこで: Incident アプリの設定バインド
 * 何を: 状態変更を許可するユーザーと報告を受け付けるチャンネルを保持する
 * なぜ: 許可リストを環境ごとに切り替えるため
 */
package com.incidentdesk.incident.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "incident.access")
public record IncidentAccessProperties(List<String> allowedActors, List<String> allowedChannels) {

  public IncidentAccessProperties {
    allowedActors = allowedActors == null ? List.of() : List.copyOf(allowedActors);
    allowedChannels = allowedChannels == null ? List.of() : List.copyOf(allowedChannels);
  }

  // 空リストは「制限なし」
  public boolean isActorAllowed(String actorId) {
    return allowedActors.isEmpty() || (actorId != null && allowedActors.contains(actorId));
  }

  public boolean isChannelAllowed(String channelId) {
    return allowedChannels.isEmpty() || (channelId != null && allowedChannels.contains(channelId));
  }
}
