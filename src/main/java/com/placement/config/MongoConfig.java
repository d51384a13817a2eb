package com.placement.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB Configuration.
 * Only enables MongoDB repositories when app.mongodb.enabled=true; otherwise the
 * in-memory record store is used and the application starts without MongoDB.
 */
@Configuration
@ConditionalOnProperty(name = "app.mongodb.enabled", havingValue = "true")
@EnableMongoRepositories(basePackages = "com.placement.repository")
public class MongoConfig {
}
