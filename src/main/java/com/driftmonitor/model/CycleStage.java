package com.driftmonitor.model;

public enum CycleStage {
    BASELINE,
    RESOLVING,
    SCORING,
    TRIGGERING
}
