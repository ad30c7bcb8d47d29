package com.driftmonitor.source;

import com.driftmonitor.config.ObservationSourceProperties;
import com.driftmonitor.exception.SourceUnavailableException;
import com.driftmonitor.model.RawObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code recent.npz}, or failing that {@code recent.json}, from the configured
 * directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiskFallbackSource implements ObservationSource {

    public static final String NAME = "disk";
    static final String NPZ_FILE = "recent.npz";
    static final String JSON_FILE = "recent.json";

    private final ObservationPayloadParser parser;
    private final ObservationSourceProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RawObservation> attempt() {
        Path dir = Path.of(properties.getDiskPath());
        Path npz = dir.resolve(NPZ_FILE);
        Path json = dir.resolve(JSON_FILE);
        try {
            if (Files.isRegularFile(npz)) {
                log.debug("Reading disk fallback | file={}", npz);
                return Optional.of(parser.parseNpz(NAME, npz));
            }
            if (Files.isRegularFile(json)) {
                log.debug("Reading disk fallback | file={}", json);
                return Optional.of(parser.parseJson(NAME, Files.readString(json, StandardCharsets.UTF_8)));
            }
        } catch (IOException ex) {
            throw new SourceUnavailableException(NAME, "could not read " + dir + ": " + ex.getMessage(), ex);
        }
        return Optional.empty();
    }
}
