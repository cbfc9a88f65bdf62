package com.cataphract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the campaign engine.
 * <p>
 * Features:
 * - Deterministic, replayable order resolution
 * - Daily ticks split into four day-parts
 * - Real-time campaign updates over WebSockets
 */
@SpringBootApplication
@EnableScheduling
public class CataphractApplication {

    public static void main(String[] args) {
        SpringApplication.run(CataphractApplication.class, args);
    }
}
