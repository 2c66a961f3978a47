package com.aboutblank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the AboutBlank cloud backup sync API.
 *
 * This Spring Boot application lets the AboutBlank mobile app back up and
 * restore a user's recovery data, featuring:
 * - Opaque auth-key authentication with implicit registration
 * - Last-write-wins upserts for progress and challenge state
 * - Append-only craving log
 * - Anonymous community message board with reactions
 * - Redis-backed per-IP rate limiting
 * - PostgreSQL with JSONB columns for check-ins and triggers
 */
@SpringBootApplication
public class AboutBlankSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(AboutBlankSyncApplication.class, args);
    }
}
