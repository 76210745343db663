/*
 * どこで: 当番表連携
 * 何を: 設定済みシフトから今日の当番を解決する
 * なぜ: 未着手インシデントの催促先を決めるため
 */
package com.incidentdesk.incident.client;

import com.incidentdesk.incident.config.DutyRosterProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfiguredDutyRosterClient implements DutyRosterClient {

  private static final Logger logger = LoggerFactory.getLogger(ConfiguredDutyRosterClient.class);

  private final DutyRosterProperties properties;
  private final Clock clock;

  @Override
  public Optional<String> currentResponsible() {
    final LocalDate today = LocalDate.now(clock.withZone(properties.zone()));
    for (DutyRosterProperties.Shift shift : properties.shifts()) {
      if (shift.covers(today)) {
        return Optional.of(shift.userId());
      }
    }
    final String fallback = properties.fallbackUserId();
    if (fallback == null || fallback.isBlank()) {
      logger.warn("no duty shift covers date={} and no fallback configured", today);
      return Optional.empty();
    }
    logger.debug("no duty shift covers date={}; using fallback userId={}", today, fallback);
    return Optional.of(fallback);
  }
}
