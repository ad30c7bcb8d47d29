package com.driftmonitor.source;

import com.driftmonitor.client.ArtifactStoreClient;
import com.driftmonitor.config.ObservationSourceProperties;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.exception.SourceUnavailableException;
import com.driftmonitor.model.RawObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Looks through recently finished tracking-server runs, newest completion first, for
 * a drift-data artifact. The first run that has one wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactStoreSource implements ObservationSource {

    public static final String NAME = "artifact-store";

    private final ArtifactStoreClient client;
    private final ObservationPayloadParser parser;
    private final ObservationSourceProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RawObservation> attempt() {
        if (!client.isConfigured()) {
            log.debug("Artifact store not configured, skipping");
            return Optional.empty();
        }

        String artifactName = properties.getArtifactName();
        String npzPath = artifactName + ".npz";
        String jsonPath = artifactName + ".json";
        int slash = artifactName.lastIndexOf('/');
        String dir = slash >= 0 ? artifactName.substring(0, slash) : "";

        List<ArtifactStoreClient.RunInfo> runs;
        try {
            runs = client.searchFinishedRuns().blockOptional().orElse(List.of());
        } catch (WebClientException ex) {
            throw new SourceUnavailableException(NAME, "run search failed: " + ex.getMessage(), ex);
        }

        for (ArtifactStoreClient.RunInfo run : runs) {
            List<String> files;
            try {
                files = client.listArtifacts(run.runId(), dir).blockOptional().orElse(List.of());
            } catch (WebClientException ex) {
                log.debug("Artifact listing failed | runId={} | reason={}", run.runId(), ex.getMessage());
                continue;
            }
            if (files.contains(npzPath)) {
                log.info("Drift artifact found | runId={} | path={}", run.runId(), npzPath);
                return Optional.of(readNpz(run.runId(), npzPath));
            }
            if (files.contains(jsonPath)) {
                log.info("Drift artifact found | runId={} | path={}", run.runId(), jsonPath);
                byte[] bytes = fetch(run.runId(), jsonPath);
                return Optional.of(parser.parseJson(NAME, new String(bytes, StandardCharsets.UTF_8)));
            }
        }
        return Optional.empty();
    }

    private RawObservation readNpz(String runId, String path) {
        byte[] bytes = fetch(runId, path);
        Path tmp = null;
        try {
            tmp = Files.createTempFile("drift-artifact-", ".npz");
            Files.write(tmp, bytes);
            return parser.parseNpz(NAME, tmp);
        } catch (IOException ex) {
            throw new SourceUnavailableException(NAME, "could not stage " + path + ": " + ex.getMessage(), ex);
        } finally {
            deleteQuietly(tmp);
        }
    }

    private byte[] fetch(String runId, String path) {
        try {
            return client.download(runId, path).blockOptional()
                .orElseThrow(() -> new MalformedDataException(NAME + ": artifact " + path + " is empty"));
        } catch (WebClientException ex) {
            throw new SourceUnavailableException(NAME, "download of " + path + " failed: " + ex.getMessage(), ex);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.debug("Temp file cleanup failed | file={} | reason={}", path, ex.getMessage());
        }
    }
}
