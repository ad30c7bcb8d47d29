package com.driftmonitor.repository;

import com.driftmonitor.entity.DriftDataRecord;
import com.driftmonitor.entity.ObservationType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DriftDataRepository extends JpaRepository<DriftDataRecord, Long> {

    Optional<DriftDataRecord> findFirstByTypeOrderByCreatedAtDescIdDesc(ObservationType type);
}
