/*
 * どこで: Incident API
 * 何を: 新規報告/ボタン操作/スレッド返信/状態参照のエンドポイントを公開する
 * なぜ: チャット側のイベント受信からライフサイクルを駆動する入口を提供するため
 */
package com.incidentdesk.incident.api;

import com.incidentdesk.incident.api.request.ReportIncidentRequest;
import com.incidentdesk.incident.api.request.ThreadMessageRequest;
import com.incidentdesk.incident.api.response.IncidentOperationResponse;
import com.incidentdesk.incident.api.response.IncidentResponse;
import com.incidentdesk.incident.model.IncidentAction;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.IncidentReport;
import com.incidentdesk.incident.model.TransitionOutcome;
import com.incidentdesk.incident.model.TransitionResult;
import com.incidentdesk.incident.service.IncidentActionResult;
import com.incidentdesk.incident.service.IncidentActionService;
import com.incidentdesk.incident.service.IncidentLifecycleService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class IncidentController {

  private static final String HEADER_ACTOR_ID = "X-Actor-Id";

  private final IncidentLifecycleService lifecycleService;
  private final IncidentActionService actionService;

  @PostMapping("/incidents")
  public ResponseEntity<IncidentOperationResponse> report(
      @Valid @RequestBody ReportIncidentRequest request) {
    if (!actionService.isChannelAllowed(request.channelId())) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN)
          .body(
              new IncidentOperationResponse(
                  "DENIED", "channel is not monitored", null, List.of()));
    }
    final TransitionResult result =
        lifecycleService.report(
            new IncidentReport(
                request.channelId(),
                request.threadTs(),
                request.authorId(),
                request.text(),
                request.threadUrl()));
    final HttpStatus status =
        result.isApplied() ? HttpStatus.CREATED : statusOf(result.outcome());
    return ResponseEntity.status(status)
        .body(
            toResponse(
                result.outcome(), result.incident(), actionService.controlsFor(result)));
  }

  @PostMapping("/incidents/{ticketKey}/actions/{actionId}")
  public ResponseEntity<IncidentOperationResponse> act(
      @PathVariable("ticketKey") String ticketKey,
      @PathVariable("actionId") String actionId,
      @RequestHeader(HEADER_ACTOR_ID) String actorId) {
    final IncidentAction action = parseAction(actionId);
    final IncidentActionResult result = actionService.handle(ticketKey, action, actorId);
    if (!result.permitted()) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN)
          .body(
              new IncidentOperationResponse(
                  "DENIED",
                  "actor is not allowed to change incidents",
                  result.incident() == null ? null : IncidentResponse.from(result.incident()),
                  IncidentResponse.actionIds(result.controls())));
    }
    return ResponseEntity.status(statusOf(result.outcome()))
        .body(toResponse(result.outcome(), result.incident(), result.controls()));
  }

  // 返信は状態に関係なく受理し、結果だけ返す
  @PostMapping("/threads/messages")
  public ResponseEntity<IncidentOperationResponse> threadMessage(
      @Valid @RequestBody ThreadMessageRequest request) {
    if (request.bot()) {
      return ResponseEntity.accepted()
          .body(new IncidentOperationResponse("IGNORED", "bot message", null, List.of()));
    }
    final TransitionResult result =
        lifecycleService.replyReceived(
            request.channelId(), request.threadTs(), request.authorId());
    return ResponseEntity.accepted()
        .body(
            toResponse(
                result.outcome(), result.incident(), actionService.controlsFor(result)));
  }

  @GetMapping("/incidents/{ticketKey}")
  public ResponseEntity<IncidentResponse> get(@PathVariable("ticketKey") String ticketKey) {
    return lifecycleService
        .find(ticketKey)
        .map(IncidentResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new IncidentNotFoundException(ticketKey));
  }

  @GetMapping("/incidents")
  public ResponseEntity<List<IncidentResponse>> listActive() {
    return ResponseEntity.ok(
        lifecycleService.listActive().stream().map(IncidentResponse::from).toList());
  }

  private IncidentAction parseAction(String actionId) {
    try {
      return IncidentAction.fromActionId(actionId);
    } catch (IllegalArgumentException ex) {
      throw new InvalidIncidentRequestException(ex.getMessage());
    }
  }

  private IncidentOperationResponse toResponse(
      TransitionOutcome outcome, IncidentRecord incident, List<IncidentAction> controls) {
    return new IncidentOperationResponse(
        outcome.name(),
        messageOf(outcome),
        incident == null ? null : IncidentResponse.from(incident),
        IncidentResponse.actionIds(controls));
  }

  private HttpStatus statusOf(TransitionOutcome outcome) {
    return switch (outcome) {
      case APPLIED -> HttpStatus.OK;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case INVALID_TRANSITION, CONFLICT, DUPLICATE -> HttpStatus.CONFLICT;
      case ADAPTER_FAILURE -> HttpStatus.BAD_GATEWAY;
    };
  }

  private String messageOf(TransitionOutcome outcome) {
    if (outcome.alreadyHandled()) {
      return "already handled";
    }
    return switch (outcome) {
      case APPLIED -> "ok";
      case NOT_FOUND -> "incident not found";
      case DUPLICATE -> "incident already reported";
      case ADAPTER_FAILURE -> "ticket tracker request failed";
      default -> throw new IllegalStateException("unhandled outcome: " + outcome);
    };
  }
}
