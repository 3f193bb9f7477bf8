package dev.harvester.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.harvester.crawl.CrawlResult;
import dev.harvester.task.Task;
import dev.harvester.task.TaskStatus;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** Status response for one task; {@code result} and {@code error} are omitted when absent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
    String taskId,
    TaskStatus status,
    @Nullable CrawlResult result,
    @Nullable String error,
    Instant createdAt,
    Instant updatedAt) {

  public static TaskView from(Task task) {
    return new TaskView(
        task.id(), task.status(), task.result(), task.error(), task.createdAt(), task.updatedAt());
  }
}
