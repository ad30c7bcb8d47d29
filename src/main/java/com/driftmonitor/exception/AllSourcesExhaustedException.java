package com.driftmonitor.exception;

import com.driftmonitor.model.SourceAttempt;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class AllSourcesExhaustedException extends DriftMonitorException {

    private final List<SourceAttempt> attempts;

    public AllSourcesExhaustedException(List<SourceAttempt> attempts) {
        super("ALL_SOURCES_EXHAUSTED",
              "No observation source produced usable data: " + attempts.stream()
                  .map(SourceAttempt::summary)
                  .collect(Collectors.joining("; ")));
        this.attempts = List.copyOf(attempts);
    }
}
