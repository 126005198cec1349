package com.civic.realtime.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Civic Realtime Service Application - Entry point for the Spring Boot application.
 *
 * Hosts the realtime distribution layer: one shared transport connection turned
 * into per-scope subscriptions with deduplication, rate limiting, automatic
 * reconnection and heartbeats, plus a small REST surface for operators.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.civic.realtime.service.config")
public class CivicRealtimeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CivicRealtimeServiceApplication.class, args);
    }
}
