package com.driftmonitor.model;

public record SourceAttempt(String source, Outcome outcome, String detail, long durationMs) {

    public enum Outcome {
        SELECTED,
        ABSENT,
        UNAVAILABLE,
        MALFORMED
    }

    public String summary() {
        return detail == null || detail.isBlank()
            ? source + "=" + outcome
            : source + "=" + outcome + " (" + detail + ")";
    }
}
