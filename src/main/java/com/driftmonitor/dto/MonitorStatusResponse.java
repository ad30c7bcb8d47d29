package com.driftmonitor.dto;

import com.driftmonitor.model.CyclePhase;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MonitorStatusResponse {
    CyclePhase phase;
    boolean baselinePresent;
    boolean handoffPending;
    List<String> sources;
    RetrainStatusResponse retrain;
    CycleOutcomeResponse lastCycle;
}
