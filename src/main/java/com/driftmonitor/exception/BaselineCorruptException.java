package com.driftmonitor.exception;

public class BaselineCorruptException extends DriftMonitorException {
    public BaselineCorruptException(String message) {
        super("BASELINE_CORRUPT", message);
    }
    public BaselineCorruptException(String message, Throwable cause) {
        super("BASELINE_CORRUPT", message, cause);
    }
}
