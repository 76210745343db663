/*
 * どこで: Reminder データアクセス
 * 何を: (ticketKey, kind) 単位の保留リマインダーと期限インデックスの永続化を抽象化する
 * なぜ: Scheduler/Worker を Redis 実装から切り離し、テスト差し替えを容易にするため
 */
package com.incidentdesk.incident.repository;

import com.incidentdesk.incident.model.ReminderKind;
import com.incidentdesk.incident.model.ReminderRecord;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

public interface ReminderRepository {

  /** 既存の同一キーを退役させてから新しい期限で登録する。 */
  void install(ReminderRecord reminder);

  /** 保存中のトークンが expectedToken と一致する場合だけ置き換える。 */
  boolean replaceIfCurrent(String expectedToken, ReminderRecord replacement);

  /** 存在すれば削除する。削除した場合 true。 */
  boolean remove(String ticketKey, ReminderKind kind);

  /** 保存中のトークンが token と一致する場合だけ削除する。 */
  boolean removeIfCurrent(String ticketKey, ReminderKind kind, String token);

  Optional<ReminderRecord> find(String ticketKey, ReminderKind kind);

  /** 期限切れのリマインダーを期限順に遅延読み込みする。消費しても削除はしない。 */
  Stream<ReminderRecord> findDue(Instant now, int limit);

  long countPending();
}
