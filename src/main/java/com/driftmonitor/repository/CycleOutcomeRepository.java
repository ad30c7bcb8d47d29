package com.driftmonitor.repository;

import com.driftmonitor.entity.CycleOutcomeRecord;
import com.driftmonitor.model.CycleStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface CycleOutcomeRepository extends JpaRepository<CycleOutcomeRecord, UUID> {

    Page<CycleOutcomeRecord> findAllByOrderByStartedAtDesc(Pageable pageable);

    Page<CycleOutcomeRecord> findByStatusOrderByStartedAtDesc(CycleStatus status, Pageable pageable);

    Optional<CycleOutcomeRecord> findFirstByOrderByStartedAtDesc();

    @Modifying
    @Query("DELETE FROM CycleOutcomeRecord c WHERE c.startedAt < :cutoff")
    int deleteStartedBefore(@Param("cutoff") Instant cutoff);
}
