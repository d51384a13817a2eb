package com.placement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Placement Offer Reconciler.
 *
 * MongoDB repositories are NOT auto-scanned at startup.
 * They are conditionally enabled via MongoConfig when app.mongodb.enabled=true.
 */
@SpringBootApplication
@EnableMongoRepositories(basePackages = "none") // Disable default scanning, MongoConfig handles it
public class PlacementReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlacementReconcilerApplication.class, args);
    }
}
