package com.driftmonitor.service;

import com.driftmonitor.exception.BaselineCorruptException;
import com.driftmonitor.exception.BaselineMissingException;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.Distributions;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Owns the persisted baseline. Writes go to a sibling temp file that is then moved
 * over the target, so a concurrent {@link #load()} sees either the old or the new
 * baseline in full.
 */
@Slf4j
@Service
public class BaselineStore {

    private final ObjectMapper mapper;
    private final Path path;
    private final double tolerance;

    public BaselineStore(ObjectMapper mapper,
                         @Value("${drift.baseline.path:drift/baseline.json}") String path,
                         @Value("${drift.baseline.tolerance:1e-3}") double tolerance) {
        this.mapper = mapper;
        this.path = Path.of(path);
        this.tolerance = tolerance;
    }

    public Baseline load() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException ex) {
            throw new BaselineMissingException(path);
        } catch (IOException ex) {
            throw new BaselineCorruptException("Baseline at '" + path + "' could not be read", ex);
        }

        PersistedBaseline persisted;
        try {
            persisted = mapper.readValue(bytes, PersistedBaseline.class);
        } catch (IOException ex) {
            throw new BaselineCorruptException("Baseline at '" + path + "' is not valid JSON", ex);
        }
        return validate(persisted);
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * Regenerates the baseline from class indices in {@code [0, classCount)}, using their
     * empirical frequencies as the label distribution.
     */
    public Baseline save(int[] labels, int classCount, List<double[]> embeddings) {
        if (labels == null || labels.length == 0) {
            throw new MalformedDataException("Baseline labels must not be empty");
        }
        if (classCount < 1) {
            throw new MalformedDataException("classCount must be at least 1");
        }
        double[] counts = new double[classCount];
        for (int label : labels) {
            if (label < 0 || label >= classCount) {
                throw new MalformedDataException("Label " + label + " is outside [0, " + classCount + ")");
            }
            counts[label]++;
        }
        for (int i = 0; i < classCount; i++) {
            counts[i] /= labels.length;
        }
        return save(counts, embeddings);
    }

    /** Regenerates the baseline from per-sample class probability vectors. */
    public Baseline saveFromProbabilities(List<double[]> perSample, List<double[]> embeddings) {
        if (perSample == null || perSample.isEmpty()) {
            throw new MalformedDataException("Baseline probabilities must not be empty");
        }
        if (perSample.stream().anyMatch(Objects::isNull)) {
            throw new MalformedDataException("Baseline probabilities contain null rows");
        }
        int classes = perSample.get(0).length;
        if (perSample.stream().anyMatch(p -> p.length != classes)) {
            throw new MalformedDataException("Baseline probability vectors differ in length");
        }
        return save(Distributions.mean(perSample, classes), embeddings);
    }

    /** Regenerates the baseline from a pre-aggregated label distribution. */
    public synchronized Baseline save(double[] distribution, List<double[]> embeddings) {
        Distributions.violation(distribution, tolerance).ifPresent(problem -> {
            throw new MalformedDataException("Baseline label distribution invalid: " + problem);
        });
        if (embeddings == null || embeddings.isEmpty()) {
            throw new MalformedDataException("Baseline embeddings must not be empty");
        }
        if (embeddings.get(0) == null || embeddings.get(0).length == 0) {
            throw new MalformedDataException("Baseline embeddings must have at least one dimension");
        }
        int dimension = embeddings.get(0).length;
        for (int i = 0; i < embeddings.size(); i++) {
            double[] e = embeddings.get(i);
            if (e == null || e.length != dimension) {
                throw new MalformedDataException(String.format(
                    "Baseline embedding %d has dimension %d, expected %d",
                    i, e == null ? 0 : e.length, dimension));
            }
            for (double v : e) {
                if (!Double.isFinite(v)) {
                    throw new MalformedDataException("Baseline embedding " + i + " contains a non-finite value");
                }
            }
        }
        double[] centroid = Distributions.mean(embeddings, dimension);
        for (double v : centroid) {
            if (!Double.isFinite(v)) {
                throw new MalformedDataException("Baseline centroid overflows to a non-finite value");
            }
        }

        Baseline baseline = new Baseline(distribution, centroid, dimension, Instant.now());
        write(baseline);
        log.info("Baseline saved | path={} | classes={} | dimension={} | samples={}",
                 path, baseline.classCount(), dimension, embeddings.size());
        return baseline;
    }

    private void write(Baseline baseline) {
        PersistedBaseline persisted = new PersistedBaseline(
            baseline.labelDistribution(), baseline.embeddingCentroid(),
            baseline.dimension(), baseline.createdAt());
        try {
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, mapper.writeValueAsBytes(persisted));
                moveAtomically(tmp, path);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to persist baseline to '" + path + "'", ex);
        }
    }

    private Baseline validate(PersistedBaseline p) {
        if (p.labelDistribution() == null || p.embeddingCentroid() == null) {
            throw new BaselineCorruptException("Baseline at '" + path + "' is missing required fields");
        }
        Distributions.violation(p.labelDistribution(), tolerance).ifPresent(problem -> {
            throw new BaselineCorruptException("Baseline label distribution invalid: " + problem);
        });
        int dimension = p.dimension() != null ? p.dimension() : p.embeddingCentroid().length;
        if (dimension < 1 || p.embeddingCentroid().length != dimension) {
            throw new BaselineCorruptException(String.format(
                "Baseline centroid has %d entries but dimension is %d",
                p.embeddingCentroid().length, dimension));
        }
        for (double v : p.embeddingCentroid()) {
            if (!Double.isFinite(v)) {
                throw new BaselineCorruptException("Baseline centroid contains a non-finite value");
            }
        }
        Instant createdAt = p.createdAt() != null ? p.createdAt() : lastModified();
        return new Baseline(p.labelDistribution(), p.embeddingCentroid(), dimension, createdAt);
    }

    private Instant lastModified() {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException ex) {
            return Instant.EPOCH;
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Files written before {@code dimension} and {@code created_at} existed use the legacy key names. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PersistedBaseline(
        @JsonProperty("label_distribution") @JsonAlias("sentiment_dist") double[] labelDistribution,
        @JsonProperty("embedding_centroid") @JsonAlias("embedding_mean") double[] embeddingCentroid,
        @JsonProperty("dimension") Integer dimension,
        @JsonProperty("created_at") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant createdAt
    ) {}
}
