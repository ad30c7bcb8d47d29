package com.driftmonitor.service;

import com.driftmonitor.dto.DriftDataPayload;
import com.driftmonitor.entity.DriftDataRecord;
import com.driftmonitor.entity.ObservationType;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.repository.DriftDataRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Append-only writer for the {@code drift_data} table. Both rows of a pair share one
 * timestamp so the relational source always sees them as consistent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationIngestService {

    private final DriftDataRepository repository;
    private final ObjectMapper mapper;

    @Transactional
    public List<DriftDataRecord> append(DriftDataPayload payload) {
        Instant now = Instant.now();
        DriftDataRecord labels = DriftDataRecord.builder()
            .type(ObservationType.LABEL_DISTRIBUTION)
            .value(toJson(payload.getSentimentDist()))
            .createdAt(now)
            .build();
        DriftDataRecord embeddings = DriftDataRecord.builder()
            .type(ObservationType.EMBEDDINGS)
            .value(toJson(payload.getEmbeddings()))
            .createdAt(now)
            .build();
        List<DriftDataRecord> saved = repository.saveAll(List.of(labels, embeddings));
        log.info("Observation rows appended | classes={} | embeddings={} | createdAt={}",
                 payload.getSentimentDist().size(), payload.getEmbeddings().size(), now);
        return saved;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new MalformedDataException("Observation payload could not be serialised", ex);
        }
    }
}
