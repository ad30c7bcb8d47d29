package com.driftmonitor.source;

import com.driftmonitor.config.ObservationSourceProperties;
import com.driftmonitor.dto.DriftDataPayload;
import com.driftmonitor.entity.DriftDataRecord;
import com.driftmonitor.entity.ObservationType;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.model.RawObservation;
import com.driftmonitor.repository.DriftDataRepository;
import com.driftmonitor.service.ObservationIngestService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
class RelationalStoreSourceTest {

    @Autowired DriftDataRepository repository;

    private final ObjectMapper mapper = new ObjectMapper();
    private ObservationSourceProperties properties;
    private RelationalStoreSource source;

    @BeforeEach
    void setUp() {
        properties = new ObservationSourceProperties();
        properties.setDatabaseUri("jdbc:h2:mem:driftdb");
        properties.setConsistencyWindow(Duration.ofMinutes(5));
        source = new RelationalStoreSource(repository, new ObservationPayloadParser(mapper), mapper, properties);
    }

    private void row(ObservationType type, String json, Instant createdAt) {
        repository.saveAndFlush(DriftDataRecord.builder().type(type).value(json).createdAt(createdAt).build());
    }

    @Test
    void attempt_emptyTable_isEmpty() {
        assertThat(source.attempt()).isEmpty();
    }

    @Test
    void attempt_notConfigured_isEmpty() {
        new ObservationIngestService(repository, mapper).append(DriftDataPayload.builder()
            .sentimentDist(List.of(0.5, 0.5))
            .embeddings(List.of(List.of(1.0, 2.0)))
            .build());
        properties.setDatabaseUri("");

        assertThat(source.attempt()).isEmpty();
    }

    @Test
    void attempt_ingestedPair_isReturned() {
        List<DriftDataRecord> saved = new ObservationIngestService(repository, mapper).append(DriftDataPayload.builder()
            .sentimentDist(List.of(0.3, 0.7))
            .embeddings(List.of(List.of(1.0, 2.0), List.of(3.0, 4.0)))
            .build());

        RawObservation raw = source.attempt().orElseThrow();

        assertThat(saved).hasSize(2).allSatisfy(r -> assertThat(r.getId()).isNotNull());
        assertThat(raw.labelDistribution()).containsExactly(0.3, 0.7);
        assertThat(raw.embeddings()).hasSize(2);
        assertThat(raw.embeddings().get(1)).containsExactly(3.0, 4.0);
    }

    @Test
    void attempt_latestRowPerTypeWins() {
        Instant earlier = Instant.parse("2026-01-01T00:00:00Z");
        Instant later = earlier.plus(Duration.ofDays(1));
        row(ObservationType.LABEL_DISTRIBUTION, "[0.9, 0.1]", earlier);
        row(ObservationType.EMBEDDINGS, "[[9.0, 9.0]]", earlier);
        row(ObservationType.LABEL_DISTRIBUTION, "[0.1, 0.9]", later);
        row(ObservationType.EMBEDDINGS, "[[1.0, 1.0]]", later.plusSeconds(30));

        RawObservation raw = source.attempt().orElseThrow();

        assertThat(raw.labelDistribution()).containsExactly(0.1, 0.9);
        assertThat(raw.embeddings().get(0)).containsExactly(1.0, 1.0);
    }

    @Test
    void attempt_onlyOneType_isMalformed() {
        row(ObservationType.EMBEDDINGS, "[[1.0, 1.0]]", Instant.now());

        assertThatThrownBy(() -> source.attempt())
            .isInstanceOf(MalformedDataException.class)
            .hasMessageContaining("only embeddings");
    }

    @Test
    void attempt_rowsOutsideConsistencyWindow_isMalformed() {
        Instant now = Instant.now();
        row(ObservationType.LABEL_DISTRIBUTION, "[0.5, 0.5]", now.minus(Duration.ofHours(1)));
        row(ObservationType.EMBEDDINGS, "[[1.0, 1.0]]", now);

        assertThatThrownBy(() -> source.attempt())
            .isInstanceOf(MalformedDataException.class)
            .hasMessageContaining("apart");
    }

    @Test
    void attempt_invalidJsonValue_isMalformed() {
        Instant now = Instant.now();
        row(ObservationType.LABEL_DISTRIBUTION, "{broken", now);
        row(ObservationType.EMBEDDINGS, "[[1.0, 1.0]]", now);

        assertThatThrownBy(() -> source.attempt())
            .isInstanceOf(MalformedDataException.class)
            .hasMessageContaining("valid JSON");
    }
}
