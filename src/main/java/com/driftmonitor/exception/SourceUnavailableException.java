package com.driftmonitor.exception;

public class SourceUnavailableException extends DriftMonitorException {
    public SourceUnavailableException(String source, String reason) {
        super("SOURCE_UNAVAILABLE", "Source '" + source + "' is unavailable: " + reason);
    }
    public SourceUnavailableException(String source, String reason, Throwable cause) {
        super("SOURCE_UNAVAILABLE", "Source '" + source + "' is unavailable: " + reason, cause);
    }
}
