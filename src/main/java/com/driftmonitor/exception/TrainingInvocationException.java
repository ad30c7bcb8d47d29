package com.driftmonitor.exception;

public class TrainingInvocationException extends DriftMonitorException {
    public TrainingInvocationException(String message) {
        super("TRAINING_INVOCATION_FAILED", message);
    }
    public TrainingInvocationException(String message, Throwable cause) {
        super("TRAINING_INVOCATION_FAILED", message, cause);
    }
}
