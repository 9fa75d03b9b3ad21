package com.whereq.tempo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Tempo.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "tempo")
@Data
public class TempoProperties {

    /**
     * User-Agent header sent with outbound webhook requests.
     */
    private String userAgent = "whereq-tempo";

    private WebhookConfig webhook = new WebhookConfig();

    @Data
    public static class WebhookConfig {
        /**
         * Send a notification when a job completes.
         */
        private boolean enabled = false;

        /**
         * Target endpoint. Notifications are skipped while blank.
         */
        private String url;

        /**
         * Shared secret sent as X-Webhook-Secret, if set.
         */
        private String secret;

        /**
         * Timeout applied to each delivery attempt.
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Total number of delivery attempts.
         */
        private int retries = 3;

        public boolean isDeliverable() {
            return enabled && url != null && !url.isBlank();
        }
    }
}
