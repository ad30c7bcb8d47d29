package com.driftmonitor.model;

import java.util.List;

/**
 * Observation data exactly as a source decoded it, before any shape checks.
 * Either field may be null when the payload lacked it.
 */
public record RawObservation(double[] labelDistribution, List<double[]> embeddings) {}
