package com.driftmonitor.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per nominal run. The primary key makes a second claim for the same run
 * fail at insert time, across processes sharing the database.
 */
@Entity
@Table(name = "cycle_locks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CycleLockRecord implements Persistable<String> {

    @Id
    @Column(name = "run_key", length = 128, updatable = false, nullable = false)
    private String runKey;

    @Column(name = "token", nullable = false, updatable = false)
    private UUID token;

    @Column(name = "owner", length = 128)
    private String owner;

    @Column(name = "acquired_at", nullable = false, updatable = false)
    private Instant acquiredAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    // Assigned ids would otherwise be merged, silently overwriting another claim.
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public String getId() {
        return runKey;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        fresh = false;
    }
}
