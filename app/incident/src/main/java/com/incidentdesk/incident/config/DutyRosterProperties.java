/*
 * どこで: Incident アプリの設定バインド
 * 何を: 当番表(シフト)と代替担当者を保持する
 * なぜ: 当番の割り当てをコード変更なしで更新するため
 */
package com.incidentdesk.incident.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "incident.duty")
public record DutyRosterProperties(
    @NotNull ZoneId zone, String fallbackUserId, @Valid List<Shift> shifts) {

  public DutyRosterProperties {
    shifts = shifts == null ? List.of() : List.copyOf(shifts);
  }

  /** start/end はともに当日を含む。 */
  public record Shift(
      String name, @NotBlank String userId, @NotNull LocalDate startDate, @NotNull LocalDate endDate) {

    @AssertTrue(message = "endDate must not be before startDate")
    public boolean isRangeValid() {
      return startDate == null || endDate == null || !endDate.isBefore(startDate);
    }

    public boolean covers(LocalDate date) {
      return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
  }
}
