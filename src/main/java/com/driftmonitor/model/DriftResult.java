package com.driftmonitor.model;

import java.time.Instant;

public record DriftResult(
    double labelScore,
    double embeddingScore,
    boolean driftDetected,
    Instant evaluatedAt
) {}
