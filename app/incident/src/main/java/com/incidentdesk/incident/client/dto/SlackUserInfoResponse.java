package com.incidentdesk.incident.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** users.info の応答。メールアドレスは users:read.email スコープがある場合のみ入る。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackUserInfoResponse(boolean ok, String error, User user) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record User(String id, Profile profile) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Profile(String email) {}
}
