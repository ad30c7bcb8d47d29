package com.driftmonitor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection parameters for the observation sources, handed to each adapter at
 * construction.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "drift.sources")
public class ObservationSourceProperties {

    /** Base URL of the MLflow tracking server; blank disables the artifact-store source. */
    private String artifactStoreLocation = "";

    /** JDBC URL of the drift-data database. */
    private String databaseUri = "";

    /** Directory holding {@code recent.npz} or {@code recent.json}. */
    private String diskPath = "drift";

    /** Name under which an upstream step publishes to the handoff channel. */
    private String channelRef = "drift-data";

    /** Upper bound for a single source attempt. */
    private Duration timeout = Duration.ofSeconds(10);

    /** Artifact path without extension; {@code .npz} and {@code .json} are tried in that order. */
    private String artifactName = "drift/recent";

    private int maxRuns = 100;

    private List<String> experimentIds = new ArrayList<>(List.of("0"));

    /** Largest gap between the latest label-distribution and embeddings rows. */
    private Duration consistencyWindow = Duration.ofMinutes(5);
}
