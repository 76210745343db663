/*
 * どこで: Incident API リクエスト DTO
 * 何を: 新規報告の入力を定義する
 * なぜ: チャットから転送された報告を型安全に取り扱うため
 */
package com.incidentdesk.incident.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReportIncidentRequest(
    @NotBlank String channelId,
    @NotBlank String threadTs,
    @NotBlank String authorId,
    @NotBlank String text,
    String threadUrl) {}
