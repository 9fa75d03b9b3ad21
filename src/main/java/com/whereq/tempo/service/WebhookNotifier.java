package com.whereq.tempo.service;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.model.WebhookJobData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service for sending job completion webhooks
 */
@Slf4j
@Service
public class WebhookNotifier {

    public static final String SECRET_HEADER = "X-Webhook-Secret";

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private TempoProperties properties;

    /**
     * Deliver a job notification to the configured endpoint.
     * <p>
     * Each attempt is bounded by the configured timeout. Transport errors,
     * timeouts and any non-2xx response (redirects included) are retried
     * immediately until the configured number of attempts is used up. Delivery failure never
     * fails the job: the returned Mono always completes with a value.
     *
     * @param jobData notification payload
     * @return Mono with true on the first 2xx response, false if disabled or all attempts failed
     */
    public Mono<Boolean> send(WebhookJobData jobData) {
        TempoProperties.WebhookConfig config = properties.getWebhook();
        if (!config.isDeliverable()) {
            return Mono.just(false);
        }

        int attempts = Math.max(1, config.getRetries());
        AtomicInteger attempt = new AtomicInteger();

        return Mono.defer(() -> {
                attempt.incrementAndGet();
                return webClientBuilder.build()
                    .post()
                    .uri(config.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> applyHeaders(headers, config))
                    .bodyValue(jobData)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), ClientResponse::createException)
                    .toBodilessEntity()
                    .timeout(config.getTimeout());
            })
            .doOnError(error -> log.warn("Webhook delivery attempt {} for job {} failed: {}",
                attempt.get(), jobData.getId(), error.toString()))
            .retryWhen(Retry.max(attempts - 1L))
            .map(response -> {
                log.debug("Webhook notification sent for job {} on attempt {}: {}",
                    jobData.getId(), attempt.get(), response.getStatusCode());
                return true;
            })
            .onErrorResume(e -> {
                log.error("Failed to send webhook notification for job {} after {} attempts",
                    jobData.getId(), attempt.get());
                return Mono.just(false);
            });
    }

    private void applyHeaders(HttpHeaders headers, TempoProperties.WebhookConfig config) {
        headers.set(HttpHeaders.USER_AGENT, properties.getUserAgent());
        if (config.getSecret() != null && !config.getSecret().isBlank()) {
            headers.set(SECRET_HEADER, config.getSecret());
        }
    }
}
