/*
 * どこで: Incident サービス層
 * 何を: (現在状態, イベント) から遷移先を決める遷移表
 * なぜ: 許可される遷移を一箇所に固定し、ボタン表示と判定を一致させるため
 */
package com.incidentdesk.incident.service;

import com.incidentdesk.incident.model.IncidentEvent;
import com.incidentdesk.incident.model.IncidentStatus;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class IncidentTransitions {

  private static final Map<IncidentEvent, Set<IncidentStatus>> SOURCES =
      new EnumMap<>(IncidentEvent.class);
  private static final Map<IncidentEvent, IncidentStatus> TARGETS =
      new EnumMap<>(IncidentEvent.class);

  static {
    register(IncidentEvent.TAKE_IN_PROGRESS, IncidentStatus.ASSIGNED, IncidentStatus.CREATED);
    register(
        IncidentEvent.AWAIT_RESPONSE,
        IncidentStatus.AWAITING_RESPONSE,
        IncidentStatus.ASSIGNED,
        IncidentStatus.FROZEN);
    register(
        IncidentEvent.REPLY_RECEIVED, IncidentStatus.ASSIGNED, IncidentStatus.AWAITING_RESPONSE);
    register(
        IncidentEvent.CLOSE,
        IncidentStatus.CLOSED,
        IncidentStatus.ASSIGNED,
        IncidentStatus.AWAITING_RESPONSE,
        IncidentStatus.FROZEN);
    register(
        IncidentEvent.FREEZE,
        IncidentStatus.FROZEN,
        IncidentStatus.ASSIGNED,
        IncidentStatus.AWAITING_RESPONSE);
  }

  private IncidentTransitions() {}

  private static void register(
      IncidentEvent event, IncidentStatus target, IncidentStatus first, IncidentStatus... rest) {
    SOURCES.put(event, EnumSet.of(first, rest));
    TARGETS.put(event, target);
  }

  /** 許可されない組み合わせでは empty を返す。 */
  public static Optional<IncidentStatus> next(IncidentStatus current, IncidentEvent event) {
    if (!SOURCES.get(event).contains(current)) {
      return Optional.empty();
    }
    return Optional.of(TARGETS.get(event));
  }

  public static boolean isAllowed(IncidentStatus current, IncidentEvent event) {
    return next(current, event).isPresent();
  }
}
