package com.driftmonitor.exception;

import java.nio.file.Path;

public class BaselineMissingException extends DriftMonitorException {
    public BaselineMissingException(Path path) {
        super("BASELINE_MISSING", "No baseline has been persisted at '" + path + "'.");
    }
}
