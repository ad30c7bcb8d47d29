package com.driftmonitor.controller;

import com.driftmonitor.config.ObservationSourceProperties;
import com.driftmonitor.dto.BaselineRegenerationRequest;
import com.driftmonitor.dto.BaselineResponse;
import com.driftmonitor.dto.CycleOutcomeResponse;
import com.driftmonitor.dto.DriftDataPayload;
import com.driftmonitor.dto.MonitorStatusResponse;
import com.driftmonitor.dto.RetrainStatusResponse;
import com.driftmonitor.entity.CycleOutcomeRecord;
import com.driftmonitor.entity.DriftDataRecord;
import com.driftmonitor.exception.MalformedDataException;
import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.CycleStatus;
import com.driftmonitor.service.BaselineStore;
import com.driftmonitor.service.CycleOutcomeService;
import com.driftmonitor.service.DriftCycleCoordinator;
import com.driftmonitor.service.ObservationIngestService;
import com.driftmonitor.service.RetrainTrigger;
import com.driftmonitor.source.DataSourceResolver;
import com.driftmonitor.source.HandoffChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DriftController {

    private final DriftCycleCoordinator coordinator;
    private final CycleOutcomeService outcomeService;
    private final RetrainTrigger retrainTrigger;
    private final BaselineStore baselineStore;
    private final HandoffChannel handoffChannel;
    private final ObservationIngestService ingestService;
    private final DataSourceResolver resolver;
    private final ObservationSourceProperties sourceProperties;
    private final ObjectMapper mapper;

    @PostMapping("/cycles")
    public ResponseEntity<CycleOutcomeResponse> runCycle(
            @RequestParam(required = false) String runKey, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /cycles | runKey={} | requestId={}", runKey, requestId);
        CycleOutcomeRecord outcome = coordinator.runManualCycle(runKey);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(CycleOutcomeService.toResponse(outcome));
    }

    @GetMapping("/cycles")
    public ResponseEntity<Page<CycleOutcomeResponse>> cycles(
            @RequestParam(required = false) CycleStatus status,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(outcomeService.history(status, PageRequest.of(page, size)));
    }

    @GetMapping("/cycles/{id}")
    public ResponseEntity<CycleOutcomeResponse> cycle(@PathVariable UUID id) {
        return ResponseEntity.ok(outcomeService.get(id));
    }

    @GetMapping("/status")
    public ResponseEntity<MonitorStatusResponse> status() {
        return ResponseEntity.ok(MonitorStatusResponse.builder()
            .phase(coordinator.currentPhase())
            .baselinePresent(baselineStore.exists())
            .handoffPending(handoffChannel.isPending(sourceProperties.getChannelRef()))
            .sources(resolver.sourceNames())
            .retrain(retrainTrigger.status())
            .lastCycle(outcomeService.latest().orElse(null))
            .build());
    }

    @GetMapping("/retrain/status")
    public ResponseEntity<RetrainStatusResponse> retrainStatus() {
        return ResponseEntity.ok(retrainTrigger.status());
    }

    @GetMapping("/baseline")
    public ResponseEntity<BaselineResponse> baseline() {
        return ResponseEntity.ok(toResponse(baselineStore.load()));
    }

    @PostMapping("/baseline")
    public ResponseEntity<BaselineResponse> regenerateBaseline(
            @Valid @RequestBody BaselineRegenerationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /baseline | samples={} | requestId={}", request.getEmbeddings().size(), requestId);
        List<double[]> embeddings = toMatrix(request.getEmbeddings());
        Baseline saved;
        if (request.getLabels() != null) {
            if (request.getLabels().stream().anyMatch(Objects::isNull)) {
                throw new MalformedDataException("labels contain null entries");
            }
            int[] labels = request.getLabels().stream().mapToInt(Integer::intValue).toArray();
            saved = baselineStore.save(labels, request.getClassCount(), embeddings);
        } else if (request.getProbabilities() != null) {
            saved = baselineStore.saveFromProbabilities(toMatrix(request.getProbabilities()), embeddings);
        } else {
            saved = baselineStore.save(toVector(request.getLabelDistribution()), embeddings);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(toResponse(saved));
    }

    @PostMapping("/handoff")
    public ResponseEntity<Map<String, Object>> handoff(
            @Valid @RequestBody DriftDataPayload payload, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        String channelRef = sourceProperties.getChannelRef();
        log.info("POST /handoff | channel={} | embeddings={} | requestId={}",
                 channelRef, payload.getEmbeddings().size(), requestId);
        handoffChannel.publish(channelRef, mapper.valueToTree(payload));
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .body(Map.of("channel", channelRef, "pending", true));
    }

    @PostMapping("/observations")
    public ResponseEntity<Map<String, Object>> appendObservations(
            @Valid @RequestBody DriftDataPayload payload, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /observations | embeddings={} | requestId={}", payload.getEmbeddings().size(), requestId);
        List<Long> ids = ingestService.append(payload).stream().map(DriftDataRecord::getId).toList();
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(Map.of("ids", ids));
    }

    private static BaselineResponse toResponse(Baseline baseline) {
        return BaselineResponse.builder()
            .labelDistribution(baseline.labelDistribution())
            .embeddingCentroid(baseline.embeddingCentroid())
            .dimension(baseline.dimension())
            .createdAt(baseline.createdAt())
            .build();
    }

    private static List<double[]> toMatrix(List<List<Double>> rows) {
        if (rows.stream().anyMatch(Objects::isNull)) {
            throw new MalformedDataException("matrix contains null rows");
        }
        return rows.stream().map(DriftController::toVector).toList();
    }

    private static double[] toVector(List<Double> values) {
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new MalformedDataException("vector contains null entries");
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
