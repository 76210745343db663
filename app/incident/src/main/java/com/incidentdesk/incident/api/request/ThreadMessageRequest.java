package com.incidentdesk.incident.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ThreadMessageRequest(
    @NotBlank String channelId, @NotBlank String threadTs, String authorId, boolean bot) {}
