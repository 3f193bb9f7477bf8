package dev.harvester.task;

import dev.harvester.crawl.CrawlResult;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of a crawl task.
 *
 * <p>A result is present exactly when the task completed and an error exactly when it failed.
 * Transitions produce new snapshots and only move forward: pending to running, running to
 * completed or failed, and pending to failed for a job that never started.
 *
 * @param id task identifier
 * @param status current status
 * @param result crawl result of a completed task
 * @param error error text of a failed task
 * @param createdAt submission time
 * @param updatedAt time of the last transition
 */
public record Task(
    String id,
    TaskStatus status,
    @Nullable CrawlResult result,
    @Nullable String error,
    Instant createdAt,
    Instant updatedAt) {

  public Task {
    if ((result != null) != (status == TaskStatus.COMPLETED)) {
      throw new IllegalArgumentException("A result is present only on completed tasks: " + id);
    }
    if ((error != null) != (status == TaskStatus.FAILED)) {
      throw new IllegalArgumentException("An error is present only on failed tasks: " + id);
    }
  }

  public static Task pending(String id, Instant now) {
    return new Task(id, TaskStatus.PENDING, null, null, now, now);
  }

  Task running(Instant now) {
    requireStatus(TaskStatus.RUNNING, TaskStatus.PENDING);
    return new Task(id, TaskStatus.RUNNING, null, null, createdAt, now);
  }

  Task completed(CrawlResult crawlResult, Instant now) {
    requireStatus(TaskStatus.COMPLETED, TaskStatus.RUNNING);
    return new Task(id, TaskStatus.COMPLETED, crawlResult, null, createdAt, now);
  }

  Task failed(String errorMessage, Instant now) {
    requireStatus(TaskStatus.FAILED, TaskStatus.PENDING, TaskStatus.RUNNING);
    return new Task(id, TaskStatus.FAILED, null, errorMessage, createdAt, now);
  }

  private void requireStatus(TaskStatus target, TaskStatus... allowedFrom) {
    for (TaskStatus allowed : allowedFrom) {
      if (status == allowed) {
        return;
      }
    }
    throw new IllegalStateException(
        "Task " + id + " cannot move from " + status.wireName() + " to " + target.wireName());
  }
}
