package com.driftmonitor.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Exactly one of {@code labels} (with {@code classCount}), {@code probabilities} or
 * {@code labelDistribution} describes the reference labels.
 */
@Value
@Builder
@Jacksonized
public class BaselineRegenerationRequest {

    List<Integer> labels;

    @Min(value = 1, message = "classCount must be >= 1")
    Integer classCount;

    List<List<Double>> probabilities;

    List<Double> labelDistribution;

    @NotEmpty(message = "embeddings are required")
    List<List<Double>> embeddings;

    @JsonIgnore
    @AssertTrue(message = "exactly one of labels, probabilities or labelDistribution is required")
    public boolean isSingleLabelSource() {
        return Stream.of(labels, probabilities, labelDistribution).filter(Objects::nonNull).count() == 1;
    }

    @JsonIgnore
    @AssertTrue(message = "classCount is required with labels")
    public boolean isClassCountPresentForLabels() {
        return labels == null || classCount != null;
    }
}
