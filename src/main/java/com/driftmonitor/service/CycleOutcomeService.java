package com.driftmonitor.service;

import com.driftmonitor.dto.CycleOutcomeResponse;
import com.driftmonitor.entity.CycleOutcomeRecord;
import com.driftmonitor.exception.CycleNotFoundException;
import com.driftmonitor.model.CycleStatus;
import com.driftmonitor.repository.CycleOutcomeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CycleOutcomeService {

    private final CycleOutcomeRepository repository;

    @Value("${drift.cycle.retention:P90D}")
    private Duration retention;

    @Transactional
    public CycleOutcomeRecord record(CycleOutcomeRecord outcome) {
        CycleOutcomeRecord saved = repository.save(outcome);
        int purged = repository.deleteStartedBefore(Instant.now().minus(retention));
        if (purged > 0) {
            log.info("Purged expired cycle outcomes | count={} | retention={}", purged, retention);
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public Page<CycleOutcomeResponse> history(CycleStatus status, Pageable pageable) {
        Page<CycleOutcomeRecord> page = status == null
            ? repository.findAllByOrderByStartedAtDesc(pageable)
            : repository.findByStatusOrderByStartedAtDesc(status, pageable);
        return page.map(CycleOutcomeService::toResponse);
    }

    @Transactional(readOnly = true)
    public CycleOutcomeResponse get(UUID id) {
        return repository.findById(id)
            .map(CycleOutcomeService::toResponse)
            .orElseThrow(() -> new CycleNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public Optional<CycleOutcomeResponse> latest() {
        return repository.findFirstByOrderByStartedAtDesc().map(CycleOutcomeService::toResponse);
    }

    public static CycleOutcomeResponse toResponse(CycleOutcomeRecord r) {
        return CycleOutcomeResponse.builder()
            .id(r.getId())
            .runKey(r.getRunKey())
            .token(r.getToken())
            .status(r.getStatus())
            .failedStage(r.getFailedStage())
            .source(r.getSource())
            .sourceAttempts(r.getSourceAttempts())
            .labelScore(r.getLabelScore())
            .embeddingScore(r.getEmbeddingScore())
            .driftDetected(r.getDriftDetected())
            .errorCode(r.getErrorCode())
            .message(r.getMessage())
            .startedAt(r.getStartedAt())
            .finishedAt(r.getFinishedAt())
            .build();
    }
}
