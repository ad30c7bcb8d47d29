package com.driftmonitor.model;

public enum CycleStatus {
    RUNNING,
    NO_DRIFT,
    RETRAIN_TRIGGERED,
    SKIPPED_RETRAIN_IN_PROGRESS,
    SKIPPED_CONCURRENT_CYCLE,
    FAILED
}
