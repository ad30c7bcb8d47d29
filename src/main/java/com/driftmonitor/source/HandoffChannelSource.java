package com.driftmonitor.source;

import com.driftmonitor.config.ObservationSourceProperties;
import com.driftmonitor.model.RawObservation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class HandoffChannelSource implements ObservationSource {

    public static final String NAME = "handoff";

    private final HandoffChannel channel;
    private final ObservationPayloadParser parser;
    private final ObservationSourceProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RawObservation> attempt() {
        return channel.take(properties.getChannelRef())
            .map(publication -> parser.parseJson(NAME, publication.payload()));
    }
}
