package com.driftmonitor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Current observation data as upstream steps publish it.
 */
@Value
@Builder
@Jacksonized
public class DriftDataPayload {

    @NotEmpty(message = "sentiment_dist is required")
    @JsonProperty("sentiment_dist")
    List<Double> sentimentDist;

    @NotEmpty(message = "embeddings are required")
    @JsonProperty("embeddings")
    List<List<Double>> embeddings;
}
