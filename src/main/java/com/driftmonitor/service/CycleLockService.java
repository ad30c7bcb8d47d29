package com.driftmonitor.service;

import com.driftmonitor.entity.CycleLockRecord;
import com.driftmonitor.model.CycleToken;
import com.driftmonitor.repository.CycleLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Claims a nominal run for one instance. Claims are never deleted, so an instance that
 * fires late for a run another instance already finished also abstains.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CycleLockService {

    private final CycleLockRepository repository;

    @Value("${drift.cycle.owner:${HOSTNAME:local}}")
    private String owner;

    public boolean tryAcquire(CycleToken token) {
        if (repository.existsById(token.runKey())) {
            log.info("Cycle already claimed | runKey={}", token.runKey());
            return false;
        }
        try {
            repository.saveAndFlush(CycleLockRecord.builder()
                .runKey(token.runKey())
                .token(token.id())
                .owner(owner)
                .acquiredAt(Instant.now())
                .build());
            return true;
        } catch (DataIntegrityViolationException ex) {
            log.info("Cycle claimed concurrently by another instance | runKey={}", token.runKey());
            return false;
        }
    }

    public void release(CycleToken token) {
        try {
            repository.findById(token.runKey())
                .filter(lock -> token.id().equals(lock.getToken()))
                .ifPresent(lock -> {
                    lock.setReleasedAt(Instant.now());
                    repository.save(lock);
                });
        } catch (DataAccessException ex) {
            log.warn("Cycle lock release failed | runKey={} | reason={}", token.runKey(), ex.getMessage());
        }
    }
}
