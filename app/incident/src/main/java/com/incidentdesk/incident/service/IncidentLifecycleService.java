/*
 * どこで: Incident サービス層
 * 何を: 報告/ボタン操作/スレッド返信をインシデントの状態遷移へ変換し、リマインダーを追従させる
 * なぜ: 状態の確定(compare-and-set)を先に行い、その結果に応じてだけリマインダーを操作するため
 */
package com.incidentdesk.incident.service;

import com.incidentdesk.incident.client.ChatClient;
import com.incidentdesk.incident.client.IntegrationException;
import com.incidentdesk.incident.client.TicketDraft;
import com.incidentdesk.incident.client.TicketTrackerClient;
import com.incidentdesk.incident.config.IncidentReminderProperties;
import com.incidentdesk.incident.model.IncidentEvent;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.IncidentReport;
import com.incidentdesk.incident.model.IncidentSnapshot;
import com.incidentdesk.incident.model.IncidentStatus;
import com.incidentdesk.incident.model.ReminderKind;
import com.incidentdesk.incident.model.TransitionOutcome;
import com.incidentdesk.incident.model.TransitionResult;
import com.incidentdesk.incident.model.UpdateResult;
import com.incidentdesk.incident.repository.DuplicateIncidentException;
import com.incidentdesk.incident.repository.IncidentRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IncidentLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(IncidentLifecycleService.class);

  private final IncidentRepository incidentRepository;
  private final ReminderScheduler reminderScheduler;
  private final TicketTrackerClient ticketTrackerClient;
  private final ChatClient chatClient;
  private final IncidentReminderProperties reminderProperties;
  private final IncidentMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 新規報告を起票し、CREATED のインシデントと default リマインダーを作る。
   * 動作: 同じスレッドの報告が既にあれば起票せず DUPLICATE を返す。起票失敗は ADAPTER_FAILURE。
   */
  public TransitionResult report(IncidentReport report) {
    final Optional<IncidentRecord> existing =
        incidentRepository.findByThread(report.channelId(), report.threadTs());
    if (existing.isPresent()) {
      logger.info(
          "incident already reported ticketKey={} channelId={} threadTs={}",
          existing.get().ticketKey(),
          report.channelId(),
          report.threadTs());
      return TransitionResult.rejected(TransitionOutcome.DUPLICATE, existing.get());
    }

    final String ticketKey;
    try {
      ticketKey =
          ticketTrackerClient.createTicket(
              TicketDraft.fromReport(report.text(), report.authorId(), report.threadUrl()));
    } catch (IntegrationException ex) {
      logger.warn(
          "ticket creation failed channelId={} threadTs={} reason={}",
          report.channelId(),
          report.threadTs(),
          ex.reason(),
          ex);
      return TransitionResult.rejected(TransitionOutcome.ADAPTER_FAILURE, null);
    }

    final IncidentRecord created =
        IncidentRecord.created(
            ticketKey,
            report.channelId(),
            report.threadTs(),
            report.authorId(),
            Instant.now(clock));
    try {
      incidentRepository.insert(created);
    } catch (DuplicateIncidentException ex) {
      // 同一スレッドの報告が並行して先に登録された。起票済みのチケットは手動で片付ける
      logger.warn(
          "incident insert lost race; orphaned tracker ticket ticketKey={} channelId={} threadTs={}",
          ticketKey,
          report.channelId(),
          report.threadTs(),
          ex);
      return TransitionResult.rejected(
          TransitionOutcome.DUPLICATE,
          incidentRepository
              .findByThread(report.channelId(), report.threadTs())
              .or(() -> incidentRepository.findByTicketKey(ticketKey))
              .orElse(null));
    }
    reminderScheduler.schedule(
        ticketKey,
        ReminderKind.DEFAULT,
        IncidentSnapshot.of(created),
        reminderProperties.defaultIntervalMinutes());
    logger.info(
        "incident created ticketKey={} channelId={} threadTs={} authorId={}",
        ticketKey,
        created.channelId(),
        created.threadTs(),
        created.authorId());
    return TransitionResult.applied(created);
  }

  /** ticketKey で指定したインシデントにイベントを適用する。 */
  public TransitionResult apply(String ticketKey, IncidentEvent event, String actorId) {
    final Optional<IncidentRecord> current = incidentRepository.findByTicketKey(ticketKey);
    if (current.isEmpty()) {
      metrics.recordTransition(event, TransitionOutcome.NOT_FOUND);
      logger.info("incident not found ticketKey={} event={}", ticketKey, event.value());
      return TransitionResult.notFound();
    }
    return applyTo(current.get(), event, actorId);
  }

  /**
   * 役割: スレッド返信を reply-received として扱う。
   * 動作: インシデントのないスレッドや返信待ちでないインシデントは無視する(エラーにしない)。
   */
  public TransitionResult replyReceived(String channelId, String threadTs, String authorId) {
    final Optional<IncidentRecord> current = incidentRepository.findByThread(channelId, threadTs);
    if (current.isEmpty()) {
      logger.debug("thread message ignored; no incident channelId={} threadTs={}", channelId,
          threadTs);
      return TransitionResult.notFound();
    }
    if (current.get().status() != IncidentStatus.AWAITING_RESPONSE) {
      logger.debug(
          "thread message ignored ticketKey={} status={}",
          current.get().ticketKey(),
          current.get().status());
      return TransitionResult.rejected(TransitionOutcome.INVALID_TRANSITION, current.get());
    }
    return applyTo(current.get(), IncidentEvent.REPLY_RECEIVED, authorId);
  }

  public Optional<IncidentRecord> find(String ticketKey) {
    return incidentRepository.findByTicketKey(ticketKey);
  }

  public List<IncidentRecord> listActive() {
    return incidentRepository.findActive();
  }

  private TransitionResult applyTo(IncidentRecord current, IncidentEvent event, String actorId) {
    final Optional<IncidentStatus> next = IncidentTransitions.next(current.status(), event);
    if (next.isEmpty()) {
      metrics.recordTransition(event, TransitionOutcome.INVALID_TRANSITION);
      logger.info(
          "incident transition rejected ticketKey={} status={} event={}",
          current.ticketKey(),
          current.status(),
          event.value());
      return TransitionResult.rejected(TransitionOutcome.INVALID_TRANSITION, current);
    }

    // クローズはトラッカー側のクローズ成功を前提条件とする
    if (event == IncidentEvent.CLOSE && !closeTicket(current.ticketKey())) {
      metrics.recordTransition(event, TransitionOutcome.ADAPTER_FAILURE);
      return TransitionResult.rejected(TransitionOutcome.ADAPTER_FAILURE, current);
    }

    final IncidentRecord updated =
        event == IncidentEvent.TAKE_IN_PROGRESS
            ? current.withAssignment(actorId, next.get())
            : current.withStatus(next.get());
    if (incidentRepository.compareAndUpdate(updated, current.status()) == UpdateResult.CONFLICT) {
      // 先行した書き込みが勝った。リマインダーには触れない
      final IncidentRecord latest =
          incidentRepository.findByTicketKey(current.ticketKey()).orElse(current);
      metrics.recordTransition(event, TransitionOutcome.CONFLICT);
      logger.info(
          "incident transition conflicted ticketKey={} expected={} actual={} event={}",
          current.ticketKey(),
          current.status(),
          latest.status(),
          event.value());
      return TransitionResult.rejected(TransitionOutcome.CONFLICT, latest);
    }

    applyReminderEffects(event, updated);
    if (event == IncidentEvent.TAKE_IN_PROGRESS) {
      assignTicket(updated.ticketKey(), actorId);
    }
    metrics.recordTransition(event, TransitionOutcome.APPLIED);
    logger.info(
        "incident transition applied ticketKey={} from={} to={} event={} actorId={}",
        updated.ticketKey(),
        current.status(),
        updated.status(),
        event.value(),
        actorId);
    return TransitionResult.applied(updated);
  }

  private void applyReminderEffects(IncidentEvent event, IncidentRecord updated) {
    final String ticketKey = updated.ticketKey();
    switch (event) {
      case TAKE_IN_PROGRESS -> reminderScheduler.cancel(ticketKey, ReminderKind.DEFAULT);
      case AWAIT_RESPONSE -> {
        reminderScheduler.cancelAll(ticketKey);
        reminderScheduler.schedule(
            ticketKey,
            ReminderKind.AWAITING_RESPONSE,
            IncidentSnapshot.of(updated),
            reminderProperties.awaitingResponseIntervalMinutes());
      }
      case REPLY_RECEIVED -> reminderScheduler.cancel(ticketKey, ReminderKind.AWAITING_RESPONSE);
      case CLOSE, FREEZE -> reminderScheduler.cancelAll(ticketKey);
      default -> throw new IllegalStateException("unhandled event: " + event);
    }
  }

  private boolean closeTicket(String ticketKey) {
    try {
      final boolean closed = ticketTrackerClient.closeTicket(ticketKey);
      if (!closed) {
        logger.warn("ticket close rejected by tracker ticketKey={}", ticketKey);
      }
      return closed;
    } catch (IntegrationException ex) {
      logger.warn("ticket close failed ticketKey={} reason={}", ticketKey, ex.reason(), ex);
      return false;
    }
  }

  // 状態遷移は確定済みのため、トラッカー側の担当設定は失敗してもログのみ
  private void assignTicket(String ticketKey, String actorId) {
    try {
      final Optional<String> email = chatClient.findUserEmail(actorId);
      if (email.isEmpty()) {
        logger.warn("ticket assignment skipped; actor email unknown ticketKey={} actorId={}",
            ticketKey, actorId);
        return;
      }
      if (!ticketTrackerClient.assignTicket(ticketKey, email.get())) {
        logger.warn("ticket assignment skipped ticketKey={} actorId={}", ticketKey, actorId);
      }
    } catch (RuntimeException ex) {
      logger.warn("ticket assignment failed ticketKey={} actorId={}", ticketKey, actorId, ex);
    }
  }
}
