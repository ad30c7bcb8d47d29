package com.driftmonitor.client;

import com.driftmonitor.config.ObservationSourceProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Thin client for the MLflow tracking server's REST API.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactStoreClient {

    private static final int MAX_DOWNLOAD_BYTES = 64 * 1024 * 1024;
    private static final String FINISHED = "FINISHED";

    private final ObservationSourceProperties properties;
    private final ObjectMapper mapper;

    private WebClient webClient;

    @PostConstruct
    void init() {
        int timeoutMillis = (int) properties.getTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.min(5_000, timeoutMillis))
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS)));
        WebClient.Builder builder = WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_DOWNLOAD_BYTES))
                .build());
        if (isConfigured()) {
            builder.baseUrl(properties.getArtifactStoreLocation());
            log.info("ArtifactStoreClient initialised → {}", properties.getArtifactStoreLocation());
        }
        this.webClient = builder.build();
    }

    public boolean isConfigured() {
        String location = properties.getArtifactStoreLocation();
        return location != null && !location.isBlank();
    }

    /** Finished runs, most recently completed first. */
    public Mono<List<RunInfo>> searchFinishedRuns() {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode experimentIds = body.putArray("experiment_ids");
        properties.getExperimentIds().forEach(experimentIds::add);
        body.put("filter", "attributes.status = '" + FINISHED + "'");
        body.put("max_results", properties.getMaxRuns());
        body.putArray("order_by").add("attributes.end_time DESC");
        return webClient.post().uri("/api/2.0/mlflow/runs/search")
            .header("Content-Type", "application/json")
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(this::toRuns);
    }

    public Mono<List<String>> listArtifacts(String runId, String path) {
        return webClient.get()
            .uri(b -> b.path("/api/2.0/mlflow/artifacts/list")
                .queryParam("run_id", runId)
                .queryParam("path", path)
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> {
                List<String> files = new ArrayList<>();
                for (JsonNode f : json.path("files")) {
                    if (!f.path("is_dir").asBoolean(false)) {
                        files.add(f.path("path").asText());
                    }
                }
                return files;
            })
            .defaultIfEmpty(List.of());
    }

    public Mono<byte[]> download(String runId, String path) {
        return webClient.get()
            .uri(b -> b.path("/get-artifact")
                .queryParam("run_uuid", runId)
                .queryParam("path", path)
                .build())
            .retrieve()
            .bodyToMono(byte[].class);
    }

    private List<RunInfo> toRuns(JsonNode json) {
        List<RunInfo> runs = new ArrayList<>();
        for (JsonNode run : json.path("runs")) {
            JsonNode info = run.path("info");
            String id = info.hasNonNull("run_id") ? info.get("run_id").asText() : info.path("run_uuid").asText();
            String status = info.path("status").asText();
            if (id.isEmpty() || !FINISHED.equals(status)) {
                continue;
            }
            runs.add(new RunInfo(id, status, info.path("end_time").asLong(0L)));
        }
        runs.sort(Comparator.comparingLong(RunInfo::endTime).reversed());
        return runs;
    }

    public record RunInfo(String runId, String status, long endTime) {}
}
