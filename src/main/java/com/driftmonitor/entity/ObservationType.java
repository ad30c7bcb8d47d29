package com.driftmonitor.entity;

import java.util.Arrays;

public enum ObservationType {
    LABEL_DISTRIBUTION("label_distribution"),
    EMBEDDINGS("embeddings");

    private final String columnValue;

    ObservationType(String columnValue) {
        this.columnValue = columnValue;
    }

    public String columnValue() {
        return columnValue;
    }

    public static ObservationType fromColumnValue(String value) {
        return Arrays.stream(values())
            .filter(t -> t.columnValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown observation type '" + value + "'"));
    }
}
