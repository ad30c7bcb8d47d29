package com.driftmonitor.controller;

import com.driftmonitor.repository.DriftDataRepository;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class DriftControllerIntegrationTest {

    private static final Path BASELINE = Path.of("target/test-drift/baseline.json");

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate restTemplate;
    @Autowired DriftDataRepository driftDataRepository;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9091));
        wireMock.start();
        WireMock.configureFor("localhost", 9091);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        stubFor(post(urlEqualTo("/train")).willReturn(aResponse().withStatus(200)));
        driftDataRepository.deleteAll();
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/baseline", Map.of(
            "labelDistribution", List.of(0.2, 0.6, 0.2),
            "embeddings", List.of(List.of(0.0, 0.0), List.of(0.0, 0.0))), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    }

    @AfterEach
    void resetStubs() throws InterruptedException {
        awaitRetrainIdle();
        wireMock.resetAll();
    }

    private Map<String, Object> payload(List<Double> dist) {
        return Map.of("sentiment_dist", dist, "embeddings", List.of(List.of(0.0, 0.0), List.of(0.0, 0.0)));
    }

    private ResponseEntity<Map> runCycle(String runKey) {
        return restTemplate.postForEntity("/api/v1/cycles?runKey=" + runKey, null, Map.class);
    }

    private void awaitRetrainIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            Map<?, ?> status = restTemplate.getForObject("/api/v1/retrain/status", Map.class);
            if (!"RUNNING".equals(status.get("state"))) {
                return;
            }
            Thread.sleep(20);
        }
    }

    @Test
    void cycle_handoffDrift_triggersTrainingOnce() throws Exception {
        ResponseEntity<Map> published = restTemplate.postForEntity("/api/v1/handoff",
            payload(List.of(0.6, 0.2, 0.2)), Map.class);
        assertThat(published.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        ResponseEntity<Map> resp = runCycle("it-drift-" + UUID.randomUUID());

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("status")).isEqualTo("RETRAIN_TRIGGERED");
        assertThat(resp.getBody().get("source")).isEqualTo("handoff");
        assertThat(((Number) resp.getBody().get("labelScore")).doubleValue()).isBetween(0.3999, 0.4001);
        awaitRetrainIdle();
        wireMock.verify(1, postRequestedFor(urlEqualTo("/train")));
        Map<?, ?> retrain = restTemplate.getForObject("/api/v1/retrain/status", Map.class);
        assertThat(retrain.get("state")).isEqualTo("SUCCEEDED");
    }

    @Test
    void cycle_handoffIsConsumedOnce() {
        restTemplate.postForEntity("/api/v1/handoff", payload(List.of(0.2, 0.6, 0.2)), Map.class);

        ResponseEntity<Map> first = runCycle("it-consume-1-" + UUID.randomUUID());
        ResponseEntity<Map> second = runCycle("it-consume-2-" + UUID.randomUUID());

        assertThat(first.getBody().get("status")).isEqualTo("NO_DRIFT");
        assertThat(second.getBody().get("status")).isEqualTo("FAILED");
        assertThat(second.getBody().get("errorCode")).isEqualTo("ALL_SOURCES_EXHAUSTED");
        assertThat(second.getBody().get("failedStage")).isEqualTo("RESOLVING");
        wireMock.verify(0, postRequestedFor(urlEqualTo("/train")));
    }

    @Test
    void cycle_fallsBackToDatabaseObservations() {
        ResponseEntity<Map> appended = restTemplate.postForEntity("/api/v1/observations",
            payload(List.of(0.2, 0.6, 0.2)), Map.class);
        assertThat(appended.getStatusCode()).isEqualTo(HttpStatus.CREATED);

        ResponseEntity<Map> resp = runCycle("it-db-" + UUID.randomUUID());

        assertThat(resp.getBody().get("status")).isEqualTo("NO_DRIFT");
        assertThat(resp.getBody().get("source")).isEqualTo("database");
        assertThat((String) resp.getBody().get("sourceAttempts"))
            .startsWith("handoff=ABSENT; artifact-store=ABSENT; database=SELECTED");
    }

    @Test
    void cycle_sameRunKeyTwice_secondAbstains() {
        String runKey = "it-dup-" + UUID.randomUUID();
        restTemplate.postForEntity("/api/v1/handoff", payload(List.of(0.6, 0.2, 0.2)), Map.class);

        ResponseEntity<Map> first = runCycle(runKey);
        restTemplate.postForEntity("/api/v1/handoff", payload(List.of(0.6, 0.2, 0.2)), Map.class);
        ResponseEntity<Map> second = runCycle(runKey);

        assertThat(first.getBody().get("status")).isEqualTo("RETRAIN_TRIGGERED");
        assertThat(second.getBody().get("status")).isEqualTo("SKIPPED_CONCURRENT_CYCLE");
        Map<?, ?> status = restTemplate.getForObject("/api/v1/status", Map.class);
        assertThat(status.get("handoffPending")).isEqualTo(true);
    }

    @Test
    void cycles_historyAndLookup() {
        ResponseEntity<Map> run = runCycle("it-history-" + UUID.randomUUID());
        String id = (String) run.getBody().get("id");

        ResponseEntity<Map> one = restTemplate.getForEntity("/api/v1/cycles/" + id, Map.class);
        assertThat(one.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(one.getBody().get("runKey")).isEqualTo(run.getBody().get("runKey"));

        ResponseEntity<Map> page = restTemplate.getForEntity("/api/v1/cycles?status=FAILED&size=5", Map.class);
        assertThat(page.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<?>) page.getBody().get("content")).isNotEmpty();
    }

    @Test
    void cycles_unknownId_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/cycles/" + UUID.randomUUID(), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("CYCLE_NOT_FOUND");
    }

    @Test
    void cycles_pageSizeOutOfRange_returns422() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/cycles?size=500", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void baseline_returnsCurrentSnapshot() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/baseline", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("dimension")).isEqualTo(2);
        assertThat((List<?>) resp.getBody().get("labelDistribution")).hasSize(3);
    }

    @Test
    void baseline_missing_returns404AndCycleFails() throws Exception {
        Files.deleteIfExists(BASELINE);

        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/baseline", Map.class);
        ResponseEntity<Map> cycle = runCycle("it-nobaseline-" + UUID.randomUUID());

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("BASELINE_MISSING");
        assertThat(cycle.getBody().get("status")).isEqualTo("FAILED");
        assertThat(cycle.getBody().get("failedStage")).isEqualTo("BASELINE");
    }

    @Test
    void baseline_fromLabels_computesFrequencies() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/baseline", Map.of(
            "labels", List.of(0, 1, 1, 1),
            "classCount", 2,
            "embeddings", List.of(List.of(1.0, 3.0), List.of(3.0, 5.0))), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getBody().get("labelDistribution")).asInstanceOf(InstanceOfAssertFactories.LIST)
            .containsExactly(0.25, 0.75);
        assertThat(resp.getBody().get("embeddingCentroid")).asInstanceOf(InstanceOfAssertFactories.LIST)
            .containsExactly(2.0, 4.0);
    }

    @Test
    void baseline_twoLabelSources_returns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/baseline", Map.of(
            "labelDistribution", List.of(1.0),
            "probabilities", List.of(List.of(1.0)),
            "embeddings", List.of(List.of(0.0))), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void baseline_invalidDistribution_returns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/baseline", Map.of(
            "labelDistribution", List.of(0.7, 0.7),
            "embeddings", List.of(List.of(0.0))), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("MALFORMED_DATA");
    }

    @Test
    void handoff_missingEmbeddings_returns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/handoff",
            Map.of("sentiment_dist", List.of(1.0)), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void status_reportsSourcesAndBaseline() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");
        ResponseEntity<Map> cycle = restTemplate.exchange("/api/v1/cycles?runKey=it-status-" + UUID.randomUUID(),
            HttpMethod.POST, new HttpEntity<>(null, headers), Map.class);
        assertThat(cycle.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");

        Map<?, ?> status = restTemplate.getForObject("/api/v1/status", Map.class);

        assertThat(status.get("phase")).isEqualTo("IDLE");
        assertThat(status.get("baselinePresent")).isEqualTo(true);
        assertThat(status.get("sources")).asInstanceOf(InstanceOfAssertFactories.LIST)
            .containsExactly("handoff", "artifact-store", "database", "disk");
        assertThat(status.get("lastCycle")).isNotNull();
    }
}
