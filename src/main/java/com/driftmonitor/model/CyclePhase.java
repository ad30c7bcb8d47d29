package com.driftmonitor.model;

public enum CyclePhase {
    IDLE,
    RESOLVING,
    SCORING,
    DECIDING,
    TRIGGERING
}
