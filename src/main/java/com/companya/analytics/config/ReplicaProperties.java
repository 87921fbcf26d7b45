package com.companya.analytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "app.replica")
public class ReplicaProperties {

    /**
     * Run the product upsert and variant replacement, or the order and item
     * upserts, inside one local transaction.
     */
    private boolean atomicParentChildWrites = true;

    private Consumer consumer = new Consumer();

    @Data
    public static class Consumer {
        private boolean enabled = true;

        /** Topics to subscribe to; empty means every topic with a registered consumer. */
        private List<String> topics = new ArrayList<>();

        private Duration pollTimeout = Duration.ofSeconds(1);

        /** Attempts per record before it is dead-lettered. 0 retries forever. */
        private int maxAttempts = 3;

        private Duration retryBackoff = Duration.ofSeconds(1);

        private String deadLetterSuffix = ".DLT";
    }
}
