package com.driftmonitor.source;

import com.driftmonitor.model.RawObservation;

import java.util.Optional;

/**
 * One place current observation data may come from.
 *
 * <p>{@link #attempt()} returns empty when the source simply has nothing to offer,
 * throws {@link com.driftmonitor.exception.SourceUnavailableException} when it cannot
 * be reached, and {@link com.driftmonitor.exception.MalformedDataException} when what
 * it holds cannot be decoded. The resolver treats all three as "try the next one".
 */
public interface ObservationSource {

    String name();

    Optional<RawObservation> attempt();
}
