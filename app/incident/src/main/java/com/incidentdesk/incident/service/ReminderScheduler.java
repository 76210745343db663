/*
 * どこで: Incident サービス層
 * 何を: (ticketKey, kind) ごとに高々 1 件のリマインダーを登録/取消/列挙する
 * なぜ: 期限計算とトークン採番を Redis 実装から分離し、Lifecycle と Worker が同じ規則を使うため
 */
package com.incidentdesk.incident.service;

import com.incidentdesk.incident.config.ReminderWorkerProperties;
import com.incidentdesk.incident.model.IncidentSnapshot;
import com.incidentdesk.incident.model.ReminderKind;
import com.incidentdesk.incident.model.ReminderRecord;
import com.incidentdesk.incident.repository.ReminderRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderScheduler {

  private static final Logger logger = LoggerFactory.getLogger(ReminderScheduler.class);

  private final ReminderRepository reminderRepository;
  private final ReminderWorkerProperties workerProperties;
  private final Clock clock;

  /** 既存の同一キーを退役させ、now + interval で登録し直す。 */
  public ReminderRecord schedule(
      String ticketKey, ReminderKind kind, IncidentSnapshot snapshot, int intervalMinutes) {
    return schedule(ticketKey, kind, snapshot, intervalMinutes, Duration.ofMinutes(intervalMinutes));
  }

  /** 初回だけ firstDelay 後に発火させる。以降の周期は intervalMinutes。 */
  public ReminderRecord schedule(
      String ticketKey,
      ReminderKind kind,
      IncidentSnapshot snapshot,
      int intervalMinutes,
      Duration firstDelay) {
    if (intervalMinutes < 1) {
      throw new IllegalArgumentException("intervalMinutes must be >= 1");
    }
    final Instant now = Instant.now(clock);
    final ReminderRecord reminder =
        new ReminderRecord(
            ticketKey, kind, newToken(), now.plus(firstDelay), intervalMinutes, snapshot, now);
    reminderRepository.install(reminder);
    logger.info(
        "reminder scheduled ticketKey={} kind={} dueAt={} intervalMinutes={}",
        ticketKey,
        kind.value(),
        reminder.dueAt(),
        intervalMinutes);
    return reminder;
  }

  /** 存在しなくても成功として扱う。 */
  public void cancel(String ticketKey, ReminderKind kind) {
    final boolean removed = reminderRepository.remove(ticketKey, kind);
    logger.info("reminder canceled ticketKey={} kind={} removed={}", ticketKey, kind.value(), removed);
  }

  public void cancelAll(String ticketKey) {
    for (ReminderKind kind : ReminderKind.values()) {
      cancel(ticketKey, kind);
    }
  }

  /**
   * 役割: Worker が観測したリマインダーを次の周期へ進める。
   * 動作: 観測後に取消/再登録された場合はトークンが変わっているため何もしない。
   */
  public boolean rescheduleIfCurrent(ReminderRecord observed, IncidentSnapshot snapshot) {
    final Instant now = Instant.now(clock);
    final ReminderRecord next =
        new ReminderRecord(
            observed.ticketKey(),
            observed.kind(),
            newToken(),
            now.plus(observed.interval()),
            observed.intervalMinutes(),
            snapshot,
            observed.createdAt());
    final boolean replaced = reminderRepository.replaceIfCurrent(observed.token(), next);
    if (!replaced) {
      logger.info(
          "reminder reschedule skipped because it changed ticketKey={} kind={}",
          observed.ticketKey(),
          observed.kind().value());
    }
    return replaced;
  }

  /** 観測した個体がまだ残っている場合だけ退役させる。 */
  public boolean retireIfCurrent(ReminderRecord observed) {
    return reminderRepository.removeIfCurrent(
        observed.ticketKey(), observed.kind(), observed.token());
  }

  public Optional<ReminderRecord> find(String ticketKey, ReminderKind kind) {
    return reminderRepository.find(ticketKey, kind);
  }

  /** 期限到来分を最大 batch-size 件まで遅延列挙する。消費しても退役はしない。 */
  public Stream<ReminderRecord> dueReminders(Instant now) {
    return reminderRepository.findDue(now, workerProperties.batchSize());
  }

  public long pendingCount() {
    return reminderRepository.countPending();
  }

  private String newToken() {
    return UUID.randomUUID().toString();
  }
}
