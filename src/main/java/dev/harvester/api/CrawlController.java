package dev.harvester.api;

import dev.harvester.task.CrawlJobScheduler;
import dev.harvester.task.CrawlRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Crawl task API: submit a crawl, poll its task, check service health.
 *
 * <p>Submissions return immediately with a task id; the outcome is only observable by polling
 * {@code GET /task/{taskId}}.
 */
@RestController
public class CrawlController {

  private final CrawlJobScheduler scheduler;

  public CrawlController(CrawlJobScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @PostMapping("/crawl")
  @ResponseStatus(HttpStatus.OK)
  public TaskSubmission submit(@RequestBody CrawlRequest request) {
    return new TaskSubmission(scheduler.submit(request));
  }

  @GetMapping("/task/{taskId}")
  public TaskView status(@PathVariable("taskId") String taskId) {
    return TaskView.from(scheduler.getStatus(taskId));
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse(
        "healthy",
        scheduler.maxConcurrentTasks(),
        scheduler.activeTasks(),
        scheduler.pendingTasks(),
        false);
  }
}
