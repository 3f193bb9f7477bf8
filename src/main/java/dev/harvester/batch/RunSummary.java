package dev.harvester.batch;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Contents of a bulk run's {@code stats.json}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunSummary(
    String baseUrl,
    int discoveredUrls,
    Instant startedAt,
    Instant finishedAt,
    BatchStats stats) {}
