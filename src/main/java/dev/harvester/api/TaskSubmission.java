package dev.harvester.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Response to a crawl submission. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskSubmission(String taskId) {}
