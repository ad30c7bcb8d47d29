package com.driftmonitor.exception;

import java.util.UUID;

public class CycleNotFoundException extends DriftMonitorException {
    public CycleNotFoundException(UUID cycleId) {
        super("CYCLE_NOT_FOUND", "Cycle outcome with id '" + cycleId + "' not found.");
    }
}
