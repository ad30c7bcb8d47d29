package com.driftmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BaselineResponse {
    double[] labelDistribution;
    double[] embeddingCentroid;
    int dimension;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
