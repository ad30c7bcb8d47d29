package com.driftmonitor.repository;

import com.driftmonitor.entity.CycleLockRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CycleLockRepository extends JpaRepository<CycleLockRecord, String> {
}
