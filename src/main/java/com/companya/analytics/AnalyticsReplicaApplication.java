package com.companya.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnalyticsReplicaApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsReplicaApplication.class, args);
    }
}
