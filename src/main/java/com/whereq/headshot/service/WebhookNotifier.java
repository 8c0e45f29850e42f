package com.whereq.headshot.service;

import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.Notifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service for sending webhook notifications on terminal job transitions
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookNotifier {

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder webClientBuilder;

    /**
     * Notify the job's webhook if it subscribed to the job's terminal status
     *
     * @param job terminal job record
     * @return Mono that completes when the notification was sent or skipped; never errors
     */
    public Mono<Void> notifyTerminal(BatchJob job) {
        Notifications notifications = job.getOptions() != null ? job.getOptions().getNotifications() : null;
        if (notifications == null || !notifications.shouldNotify(job.getStatus())) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(notifications.getWebhook())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(job))
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                job.getId(), job.getStatus(), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job {}: {}",
                job.getId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail job if webhook fails
            .then();
    }

    Map<String, Object> buildPayload(BatchJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getId());
        payload.put("status", job.getStatus().name());
        payload.put("timestamp", System.currentTimeMillis());

        if (job.getResults() != null) {
            payload.put("result", job.getResults());
        }
        if (job.getErrorDetails() != null) {
            payload.put("error", job.getErrorDetails());
        }
        return payload;
    }
}
