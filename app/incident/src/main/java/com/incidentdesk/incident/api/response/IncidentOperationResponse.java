package com.incidentdesk.incident.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/** 報告/ボタン操作/返信の結果。controls は現在状態に対応するボタンで、拒否時も含める。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、防御的コピーを行わないため")
public record IncidentOperationResponse(
    String outcome, String message, IncidentResponse incident, List<String> controls) {}
