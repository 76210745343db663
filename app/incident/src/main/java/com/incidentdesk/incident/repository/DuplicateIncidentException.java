/*
 * どこで: Incident データアクセス
 * 何を: ticket_key もしくはスレッドの重複登録を表す例外を定義する
 * なぜ: 一意制約違反をドメインの DuplicateKey として扱うため
 */
package com.incidentdesk.incident.repository;

public class DuplicateIncidentException extends RuntimeException {

  public DuplicateIncidentException(String message, Throwable cause) {
    super(message, cause);
  }
}
