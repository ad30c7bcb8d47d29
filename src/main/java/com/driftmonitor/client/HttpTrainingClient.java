package com.driftmonitor.client;

import com.driftmonitor.exception.TrainingInvocationException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.HttpClient;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Calls the training service's HTTP entry point. The call carries no parameters;
 * only the response status is inspected.
 */
@Slf4j
@Component
public class HttpTrainingClient implements TrainingEntryPoint {

    @Value("${drift.training.base-url}")
    private String baseUrl;

    @Value("${drift.training.path:/train}")
    private String path;

    @Value("${drift.training.timeout-seconds:3600}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
        log.info("HttpTrainingClient initialised → {}{}", baseUrl, path);
    }

    @Override
    public void train() {
        try {
            webClient.post().uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(b -> new TrainingInvocationException(
                        "Training endpoint returned " + resp.statusCode().value() + ": " + b)))
                .toBodilessEntity()
                .block();
        } catch (WebClientRequestException ex) {
            throw new TrainingInvocationException("Training endpoint unreachable: " + ex.getMessage(), ex);
        }
    }
}
