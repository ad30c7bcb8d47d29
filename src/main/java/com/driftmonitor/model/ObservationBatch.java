package com.driftmonitor.model;

import com.driftmonitor.exception.MalformedDataException;

import java.util.ArrayList;
import java.util.List;

/**
 * Current observation data that passed the well-formedness check against the
 * baseline's class count and embedding dimension. Never empty.
 */
public final class ObservationBatch {

    private final String source;
    private final double[] labelDistribution;
    private final List<double[]> embeddings;

    private ObservationBatch(String source, double[] labelDistribution, List<double[]> embeddings) {
        this.source = source;
        this.labelDistribution = labelDistribution;
        this.embeddings = embeddings;
    }

    /**
     * Validates {@code raw} and copies it into a batch.
     *
     * @throws MalformedDataException if a field is missing, the distribution is not a
     *         probability vector over {@code expectedClasses} classes, there are no
     *         embeddings, or any embedding's dimension differs from {@code expectedDimension}
     */
    public static ObservationBatch wellFormed(String source, RawObservation raw,
                                              int expectedClasses, int expectedDimension, double tolerance) {
        if (raw == null) {
            throw new MalformedDataException(source + ": payload is empty");
        }
        if (raw.labelDistribution() == null) {
            throw new MalformedDataException(source + ": missing label distribution");
        }
        Distributions.violation(raw.labelDistribution(), tolerance).ifPresent(problem -> {
            throw new MalformedDataException(source + ": label distribution invalid, " + problem);
        });
        if (raw.labelDistribution().length != expectedClasses) {
            throw new MalformedDataException(String.format(
                "%s: label distribution has %d classes, expected %d",
                source, raw.labelDistribution().length, expectedClasses));
        }
        if (raw.embeddings() == null || raw.embeddings().isEmpty()) {
            throw new MalformedDataException(source + ": no embeddings");
        }
        List<double[]> copies = new ArrayList<>(raw.embeddings().size());
        for (int i = 0; i < raw.embeddings().size(); i++) {
            double[] e = raw.embeddings().get(i);
            if (e == null || e.length != expectedDimension) {
                throw new MalformedDataException(String.format(
                    "%s: embedding %d has dimension %d, expected %d",
                    source, i, e == null ? 0 : e.length, expectedDimension));
            }
            for (double v : e) {
                if (!Double.isFinite(v)) {
                    throw new MalformedDataException(source + ": embedding " + i + " contains a non-finite value");
                }
            }
            copies.add(e.clone());
        }
        return new ObservationBatch(source, raw.labelDistribution().clone(), List.copyOf(copies));
    }

    public String source() {
        return source;
    }

    public double[] labelDistribution() {
        return labelDistribution.clone();
    }

    public int size() {
        return embeddings.size();
    }

    public int dimension() {
        return embeddings.get(0).length;
    }

    public double[] meanEmbedding() {
        return Distributions.mean(embeddings, dimension());
    }

    @Override
    public String toString() {
        return "ObservationBatch[source=" + source + ", classes=" + labelDistribution.length
            + ", embeddings=" + embeddings.size() + "x" + dimension() + "]";
    }
}
