package com.driftmonitor.dto;

import com.driftmonitor.model.CycleStage;
import com.driftmonitor.model.CycleStatus;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CycleOutcomeResponse {
    UUID id;
    String runKey;
    UUID token;
    CycleStatus status;
    CycleStage failedStage;
    String source;
    String sourceAttempts;
    Double labelScore;
    Double embeddingScore;
    Boolean driftDetected;
    String errorCode;
    String message;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant finishedAt;
}
