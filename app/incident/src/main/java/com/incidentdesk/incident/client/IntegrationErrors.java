/*
 * どこで: 外部連携クライアント共通
 * 何を: RestClient の例外を IntegrationException の理由コードへ変換する
 * なぜ: Jira/Slack で同じ分類を使い、呼び出し側の判定を揃えるため
 */
package com.incidentdesk.incident.client;

import java.net.SocketTimeoutException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class IntegrationErrors {

  private IntegrationErrors() {}

  static IntegrationException fromResponse(String system, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401) {
      return new IntegrationException(
          IntegrationException.Reason.UNAUTHORIZED, system + " rejected credentials", ex);
    }
    if (status == 403) {
      return new IntegrationException(
          IntegrationException.Reason.FORBIDDEN, system + " denied access", ex);
    }
    if (status == 404) {
      return new IntegrationException(
          IntegrationException.Reason.NOT_FOUND, system + " resource not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new IntegrationException(
          IntegrationException.Reason.BAD_GATEWAY, system + " server error", ex);
    }
    return new IntegrationException(
        IntegrationException.Reason.BAD_GATEWAY, system + " request failed status=" + status, ex);
  }

  static IntegrationException fromResourceAccess(String system, ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return new IntegrationException(
            IntegrationException.Reason.TIMEOUT, system + " request timeout", ex);
      }
      current = current.getCause();
    }
    return new IntegrationException(
        IntegrationException.Reason.BAD_GATEWAY, system + " connection failed", ex);
  }

  // 200 で HTML が返る(プロキシ/SSO)などの変換失敗
  static IntegrationException unreadable(String system, RuntimeException ex) {
    return new IntegrationException(
        IntegrationException.Reason.INVALID_RESPONSE, system + " response parse failed", ex);
  }

  static IntegrationException invalidResponse(String system, String detail) {
    return new IntegrationException(
        IntegrationException.Reason.INVALID_RESPONSE, system + " response is invalid: " + detail);
  }
}
