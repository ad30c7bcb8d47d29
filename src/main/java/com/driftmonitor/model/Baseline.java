package com.driftmonitor.model;

import java.time.Instant;
import java.util.Arrays;

/**
 * Reference snapshot that drift is measured against. Immutable; a regeneration
 * replaces the whole snapshot.
 */
public record Baseline(
    double[] labelDistribution,
    double[] embeddingCentroid,
    int dimension,
    Instant createdAt
) {
    public Baseline {
        labelDistribution = labelDistribution.clone();
        embeddingCentroid = embeddingCentroid.clone();
    }

    @Override
    public double[] labelDistribution() {
        return labelDistribution.clone();
    }

    @Override
    public double[] embeddingCentroid() {
        return embeddingCentroid.clone();
    }

    public int classCount() {
        return labelDistribution.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Baseline other)) {
            return false;
        }
        return dimension == other.dimension
            && Arrays.equals(labelDistribution, other.labelDistribution)
            && Arrays.equals(embeddingCentroid, other.embeddingCentroid)
            && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(labelDistribution);
        result = 31 * result + Arrays.hashCode(embeddingCentroid);
        result = 31 * result + dimension;
        return 31 * result + createdAt.hashCode();
    }

    @Override
    public String toString() {
        return "Baseline[classes=" + labelDistribution.length + ", dimension=" + dimension
            + ", createdAt=" + createdAt + "]";
    }
}
