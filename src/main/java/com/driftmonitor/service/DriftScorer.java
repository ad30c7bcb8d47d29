package com.driftmonitor.service;

import com.driftmonitor.config.DriftThresholdProperties;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.ObservationBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Scores an observation batch against the baseline. Either signal crossing its
 * threshold is enough to report drift.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftScorer {

    private final DriftThresholdProperties thresholds;

    public DriftResult score(Baseline baseline, ObservationBatch batch) {
        double[] current = batch.labelDistribution();
        if (current.length != baseline.classCount()) {
            throw new MalformedDataException(String.format(
                "Observation has %d classes but the baseline has %d", current.length, baseline.classCount()));
        }
        if (batch.dimension() != baseline.dimension()) {
            throw new MalformedDataException(String.format(
                "Observation embeddings have dimension %d but the baseline has %d",
                batch.dimension(), baseline.dimension()));
        }

        double labelScore = labelScore(baseline.labelDistribution(), current);
        double embeddingScore = embeddingScore(baseline.embeddingCentroid(), batch.meanEmbedding());
        boolean drift = labelScore > thresholds.getLabel() || embeddingScore > thresholds.getEmbedding();

        log.info("Drift scored | source={} | labelScore={} | embeddingScore={} | labelThreshold={} | embeddingThreshold={} | drift={}",
                 batch.source(), round(labelScore), round(embeddingScore),
                 thresholds.getLabel(), thresholds.getEmbedding(), drift);
        return new DriftResult(labelScore, embeddingScore, drift, Instant.now());
    }

    /** Total-variation distance, clamped to [0, 1] against rounding. */
    static double labelScore(double[] p, double[] q) {
        if (p.length != q.length) {
            throw new MalformedDataException("Distributions differ in length: " + p.length + " vs " + q.length);
        }
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            sum += Math.abs(p[i] - q[i]);
        }
        return Math.min(1.0, Math.max(0.0, 0.5 * sum));
    }

    static double embeddingScore(double[] centroid, double[] mean) {
        if (centroid.length != mean.length) {
            throw new MalformedDataException("Vectors differ in length: " + centroid.length + " vs " + mean.length);
        }
        double sq = 0.0;
        for (int i = 0; i < centroid.length; i++) {
            double d = centroid[i] - mean[i];
            sq += d * d;
        }
        return Math.sqrt(sq);
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
