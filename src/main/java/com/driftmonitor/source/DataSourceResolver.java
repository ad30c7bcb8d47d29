package com.driftmonitor.source;

import com.driftmonitor.config.ObservationSourceProperties;
import com.driftmonitor.exception.AllSourcesExhaustedException;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.exception.SourceUnavailableException;
import com.driftmonitor.model.ObservationBatch;
import com.driftmonitor.model.RawObservation;
import com.driftmonitor.model.SourceAttempt;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tries the observation sources one after another, in fixed priority order, and
 * returns the first well-formed batch. Sources are never merged. Each attempt is
 * bounded by the configured timeout; a timeout counts as the source being
 * unavailable.
 */
@Slf4j
@Service
public class DataSourceResolver {

    private final List<ObservationSource> sources;
    private final Duration timeout;
    private final double tolerance;
    private final ExecutorService executor;

    @Autowired
    public DataSourceResolver(HandoffChannelSource handoff,
                              ArtifactStoreSource artifactStore,
                              RelationalStoreSource database,
                              DiskFallbackSource disk,
                              ObservationSourceProperties properties,
                              @Value("${drift.baseline.tolerance:1e-3}") double tolerance) {
        this(List.of(handoff, artifactStore, database, disk), properties.getTimeout(), tolerance);
    }

    public DataSourceResolver(List<ObservationSource> sources, Duration timeout, double tolerance) {
        this.sources = List.copyOf(sources);
        this.timeout = timeout;
        this.tolerance = tolerance;
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "drift-source-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    public List<String> sourceNames() {
        return sources.stream().map(ObservationSource::name).toList();
    }

    /**
     * @throws AllSourcesExhaustedException when no source yields a well-formed batch
     *         over {@code expectedClasses} classes whose embeddings have
     *         {@code expectedDimension} entries
     */
    public Resolution resolve(int expectedClasses, int expectedDimension) {
        List<SourceAttempt> attempts = new ArrayList<>();
        for (ObservationSource source : sources) {
            long start = System.nanoTime();
            try {
                Optional<RawObservation> raw = attemptWithTimeout(source);
                long elapsed = elapsedMillis(start);
                if (raw.isEmpty()) {
                    log.info("Source had no data | source={} | durationMs={}", source.name(), elapsed);
                    attempts.add(new SourceAttempt(source.name(), SourceAttempt.Outcome.ABSENT, null, elapsed));
                    continue;
                }
                ObservationBatch batch = ObservationBatch.wellFormed(
                    source.name(), raw.get(), expectedClasses, expectedDimension, tolerance);
                attempts.add(new SourceAttempt(source.name(), SourceAttempt.Outcome.SELECTED, null, elapsed));
                log.info("Observation source selected | source={} | embeddings={} | durationMs={}",
                         source.name(), batch.size(), elapsed);
                return new Resolution(batch, List.copyOf(attempts));
            } catch (MalformedDataException ex) {
                long elapsed = elapsedMillis(start);
                log.warn("Source rejected, malformed data | source={} | reason={}", source.name(), ex.getMessage());
                attempts.add(new SourceAttempt(source.name(), SourceAttempt.Outcome.MALFORMED, ex.getMessage(), elapsed));
            } catch (SourceUnavailableException ex) {
                long elapsed = elapsedMillis(start);
                log.warn("Source rejected, unavailable | source={} | reason={}", source.name(), ex.getMessage());
                attempts.add(new SourceAttempt(source.name(), SourceAttempt.Outcome.UNAVAILABLE, ex.getMessage(), elapsed));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                attempts.add(new SourceAttempt(source.name(), SourceAttempt.Outcome.UNAVAILABLE,
                    "interrupted", elapsedMillis(start)));
                break;
            }
        }
        throw new AllSourcesExhaustedException(attempts);
    }

    private Optional<RawObservation> attemptWithTimeout(ObservationSource source) throws InterruptedException {
        Future<Optional<RawObservation>> future = executor.submit(source::attempt);
        try {
            Optional<RawObservation> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : Optional.empty();
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new SourceUnavailableException(source.name(), "timed out after " + timeout.toMillis() + "ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof MalformedDataException malformed) {
                throw malformed;
            }
            if (cause instanceof SourceUnavailableException unavailable) {
                throw unavailable;
            }
            throw new SourceUnavailableException(source.name(),
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public record Resolution(ObservationBatch batch, List<SourceAttempt> attempts) {}
}
