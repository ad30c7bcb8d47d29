package com.driftmonitor.source;

import com.driftmonitor.config.ObservationSourceProperties;
import com.driftmonitor.entity.DriftDataRecord;
import com.driftmonitor.entity.ObservationType;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.exception.SourceUnavailableException;
import com.driftmonitor.model.RawObservation;
import com.driftmonitor.repository.DriftDataRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads the newest {@code label_distribution} and {@code embeddings} rows. The pair is
 * only accepted when both exist and were written within the consistency window of
 * each other.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelationalStoreSource implements ObservationSource {

    public static final String NAME = "database";

    private final DriftDataRepository repository;
    private final ObservationPayloadParser parser;
    private final ObjectMapper mapper;
    private final ObservationSourceProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RawObservation> attempt() {
        String uri = properties.getDatabaseUri();
        if (uri == null || uri.isBlank()) {
            log.debug("Drift database not configured, skipping");
            return Optional.empty();
        }

        Optional<DriftDataRecord> labels;
        Optional<DriftDataRecord> embeddings;
        try {
            labels = repository.findFirstByTypeOrderByCreatedAtDescIdDesc(ObservationType.LABEL_DISTRIBUTION);
            embeddings = repository.findFirstByTypeOrderByCreatedAtDescIdDesc(ObservationType.EMBEDDINGS);
        } catch (DataAccessException ex) {
            throw new SourceUnavailableException(NAME, "query failed: " + ex.getMostSpecificCause().getMessage(), ex);
        }

        if (labels.isEmpty() && embeddings.isEmpty()) {
            return Optional.empty();
        }
        if (labels.isEmpty() || embeddings.isEmpty()) {
            throw new MalformedDataException(NAME + ": only "
                + (labels.isPresent() ? "label_distribution" : "embeddings") + " rows are present");
        }

        DriftDataRecord l = labels.get();
        DriftDataRecord e = embeddings.get();
        Duration gap = Duration.between(l.getCreatedAt(), e.getCreatedAt()).abs();
        if (gap.compareTo(properties.getConsistencyWindow()) > 0) {
            throw new MalformedDataException(String.format(
                "%s: latest rows are %ds apart (label_distribution id=%d, embeddings id=%d), window is %ds",
                NAME, gap.toSeconds(), l.getId(), e.getId(), properties.getConsistencyWindow().toSeconds()));
        }

        log.debug("Drift rows selected | labelRowId={} | embeddingsRowId={}", l.getId(), e.getId());
        return Optional.of(new RawObservation(
            parser.distribution(NAME, readTree(l)),
            parser.matrix(NAME, ObservationPayloadParser.EMBEDDINGS_KEY, readTree(e))));
    }

    private JsonNode readTree(DriftDataRecord record) {
        try {
            return mapper.readTree(record.getValue());
        } catch (JsonProcessingException ex) {
            throw new MalformedDataException(NAME + ": row " + record.getId() + " does not hold valid JSON", ex);
        }
    }
}
