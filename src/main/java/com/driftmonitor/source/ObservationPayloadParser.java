package com.driftmonitor.source;

import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.model.Distributions;
import com.driftmonitor.model.RawObservation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes the drift-data payload shared by the handoff channel, the artifact store
 * and the disk fallback: a {@code sentiment_dist} vector and an {@code embeddings}
 * matrix, as JSON or as a NumPy archive.
 *
 * <p>A two-dimensional {@code sentiment_dist} holds per-sample class probabilities
 * and is averaged column-wise into one distribution.
 */
@Component
@RequiredArgsConstructor
public class ObservationPayloadParser {

    public static final String SENTIMENT_KEY = "sentiment_dist";
    public static final String EMBEDDINGS_KEY = "embeddings";

    private final ObjectMapper mapper;

    public RawObservation parseJson(String source, String json) {
        try {
            return parseJson(source, mapper.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new MalformedDataException(source + ": payload is not valid JSON", ex);
        }
    }

    public RawObservation parseJson(String source, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedDataException(source + ": payload must be a JSON object");
        }
        if (!root.hasNonNull(SENTIMENT_KEY) || !root.hasNonNull(EMBEDDINGS_KEY)) {
            throw new MalformedDataException(source + ": payload requires '" + SENTIMENT_KEY
                + "' and '" + EMBEDDINGS_KEY + "'");
        }
        return new RawObservation(
            distribution(source, root.get(SENTIMENT_KEY)),
            matrix(source, EMBEDDINGS_KEY, root.get(EMBEDDINGS_KEY)));
    }

    public RawObservation parseNpz(String source, Path archive) throws IOException {
        Map<String, NpzReader.NpyArray> arrays = NpzReader.read(archive);
        NpzReader.NpyArray dist = arrays.get(SENTIMENT_KEY);
        NpzReader.NpyArray emb = arrays.get(EMBEDDINGS_KEY);
        if (dist == null || emb == null) {
            throw new MalformedDataException(source + ": archive requires '" + SENTIMENT_KEY
                + "' and '" + EMBEDDINGS_KEY + "', found " + arrays.keySet());
        }
        double[] distribution;
        if (dist.rank() == 1) {
            distribution = dist.values();
        } else if (dist.rank() == 2) {
            distribution = columnMean(source, rows(dist));
        } else {
            throw new MalformedDataException(source + ": '" + SENTIMENT_KEY + "' must be 1-D or 2-D");
        }
        if (emb.rank() != 2) {
            throw new MalformedDataException(source + ": '" + EMBEDDINGS_KEY + "' must be 2-D, was "
                + emb.rank() + "-D");
        }
        return new RawObservation(distribution, rows(emb));
    }

    /** Accepts a flat numeric vector or a list of per-sample vectors. */
    public double[] distribution(String source, JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new MalformedDataException(source + ": '" + SENTIMENT_KEY + "' must be a non-empty array");
        }
        if (node.get(0).isArray()) {
            return columnMean(source, matrix(source, SENTIMENT_KEY, node));
        }
        return vector(source, SENTIMENT_KEY, node);
    }

    public List<double[]> matrix(String source, String field, JsonNode node) {
        if (!node.isArray()) {
            throw new MalformedDataException(source + ": '" + field + "' must be an array of vectors");
        }
        List<double[]> rows = new ArrayList<>(node.size());
        for (JsonNode row : node) {
            rows.add(vector(source, field, row));
        }
        return rows;
    }

    private double[] vector(String source, String field, JsonNode node) {
        if (!node.isArray()) {
            throw new MalformedDataException(source + ": '" + field + "' contains a non-array element");
        }
        double[] out = new double[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode v = node.get(i);
            if (!v.isNumber()) {
                throw new MalformedDataException(source + ": '" + field + "' contains non-numeric value " + v);
            }
            out[i] = v.asDouble();
        }
        return out;
    }

    private List<double[]> rows(NpzReader.NpyArray array) {
        List<double[]> rows = new ArrayList<>(array.shape()[0]);
        for (int i = 0; i < array.shape()[0]; i++) {
            rows.add(array.row(i));
        }
        return rows;
    }

    private double[] columnMean(String source, List<double[]> rows) {
        if (rows.isEmpty()) {
            throw new MalformedDataException(source + ": '" + SENTIMENT_KEY + "' has no samples");
        }
        int width = rows.get(0).length;
        for (double[] row : rows) {
            if (row.length != width) {
                throw new MalformedDataException(source + ": '" + SENTIMENT_KEY + "' rows differ in length");
            }
        }
        return Distributions.mean(rows, width);
    }
}
