package dev.harvester.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Liveness and load of the crawl service. LLM extraction is never enabled. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthResponse(
    String status,
    int maxConcurrentTasks,
    long activeTasks,
    long pendingTasks,
    boolean llmEnabled) {}
