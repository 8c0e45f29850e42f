package com.whereq.headshot.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.exception.ProviderException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Generation provider speaking a prediction-style HTTP API: create a prediction, then poll it
 * until it finishes.
 */
@Slf4j
@Service
public class HttpGenerationProvider implements GenerationProvider {

    private static final Set<String> FINISHED = Set.of("succeeded", "failed", "canceled");

    private final WebClient webClient;
    private final String modelVersion;
    private final Duration pollInterval;

    public HttpGenerationProvider(@Qualifier("generationProviderWebClient") WebClient webClient,
                                  HeadshotProperties properties) {
        this.webClient = webClient;
        this.modelVersion = properties.getProvider().getModelVersion();
        this.pollInterval = properties.getProvider().getPollInterval();
    }

    @Override
    public Mono<GenerationResult> generate(GenerationRequest request, Consumer<String> onHandleAssigned) {
        return webClient.post()
            .uri("/predictions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildBody(request))
            .retrieve()
            .bodyToMono(Prediction.class)
            .doOnNext(prediction -> {
                log.debug("Prediction {} created for job {} style {}",
                    prediction.getId(), request.getJobId(), request.getStyle());
                onHandleAssigned.accept(prediction.getId());
            })
            .flatMap(this::awaitCompletion)
            .flatMap(prediction -> toResult(prediction, request))
            .onErrorMap(WebClientResponseException.class, e -> new ProviderException(
                "Provider returned " + e.getStatusCode().value() + " for style " + request.getStyle(), e));
    }

    @Override
    public Mono<Void> cancel(String handle) {
        return webClient.post()
            .uri("/predictions/{id}/cancel", handle)
            .retrieve()
            .toBodilessEntity()
            .doOnSuccess(response -> log.info("Cancelled prediction {}", handle))
            .then();
    }

    private Mono<Prediction> awaitCompletion(Prediction created) {
        if (created.isFinished()) {
            return Mono.just(created);
        }
        return Flux.interval(pollInterval)
            .concatMap(tick -> webClient.get()
                .uri("/predictions/{id}", created.getId())
                .retrieve()
                .bodyToMono(Prediction.class))
            .filter(Prediction::isFinished)
            .next();
    }

    private Mono<GenerationResult> toResult(Prediction prediction, GenerationRequest request) {
        if (!"succeeded".equals(prediction.getStatus())) {
            String reason = prediction.getError() != null ? prediction.getError() : "prediction " + prediction.getStatus();
            return Mono.error(new ProviderException("Style generation failed: " + reason));
        }

        List<String> outputs = new ArrayList<>();
        JsonNode output = prediction.getOutput();
        if (output != null && output.isArray()) {
            output.forEach(node -> outputs.add(node.asText()));
        } else if (output != null && output.isTextual()) {
            outputs.add(output.asText());
        }

        if (outputs.isEmpty()) {
            return Mono.error(new ProviderException("Provider returned no images for style " + request.getStyle()));
        }

        return Mono.just(GenerationResult.builder()
            .handle(prediction.getId())
            .success(true)
            .outputs(outputs)
            .build());
    }

    private Map<String, Object> buildBody(GenerationRequest request) {
        Map<String, Object> input = new HashMap<>();
        if (request.getParameters() != null) {
            input.putAll(request.getParameters());
        }
        input.put("image", "data:image/jpeg;base64," + request.getImageBase64());
        input.put("style", request.getStyle());
        input.put("num_outputs", request.getOutputCount());

        Map<String, Object> body = new HashMap<>();
        if (modelVersion != null) {
            body.put("version", modelVersion);
        }
        body.put("input", input);
        return body;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Prediction {
        private String id;
        private String status;
        private JsonNode output;
        private String error;

        boolean isFinished() {
            return status != null && FINISHED.contains(status);
        }
    }
}
