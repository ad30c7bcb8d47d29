package com.driftmonitor.exception;

public class MalformedDataException extends DriftMonitorException {
    public MalformedDataException(String message) {
        super("MALFORMED_DATA", message);
    }
    public MalformedDataException(String message, Throwable cause) {
        super("MALFORMED_DATA", message, cause);
    }
}
