package com.driftmonitor.entity;

import com.driftmonitor.model.CycleStage;
import com.driftmonitor.model.CycleStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "cycle_outcomes",
    indexes = {
        @Index(name = "idx_cycle_run_key", columnList = "run_key"),
        @Index(name = "idx_cycle_started", columnList = "started_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CycleOutcomeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "run_key", nullable = false, length = 128)
    private String runKey;

    @Column(name = "token", nullable = false)
    private UUID token;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private CycleStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failed_stage", length = 20)
    private CycleStage failedStage;

    @Column(name = "source", length = 40)
    private String source;

    @Column(name = "source_attempts", length = 2000)
    private String sourceAttempts;

    @Column(name = "label_score")
    private Double labelScore;

    @Column(name = "embedding_score")
    private Double embeddingScore;

    @Column(name = "drift_detected")
    private Boolean driftDetected;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "message", length = 2000)
    private String message;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;
}
