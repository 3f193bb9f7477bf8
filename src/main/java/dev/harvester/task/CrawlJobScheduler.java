package dev.harvester.task;

import dev.harvester.crawl.PageCrawlOutcome;
import dev.harvester.crawl.PageCrawler;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts crawl submissions and runs them on a fixed pool of workers.
 *
 * <p>{@link #submit} registers a pending task, queues a job and returns at once. Exactly {@code
 * max-concurrent-tasks} worker threads take jobs from an unbounded priority queue, so at most that
 * many tasks run at a time and the rest wait as pending. Each worker owns its task until it reaches
 * a terminal state; nothing a crawl throws escapes the worker.
 */
@Service
public class CrawlJobScheduler {

  private static final Logger log = LoggerFactory.getLogger(CrawlJobScheduler.class);

  private final TaskStore taskStore;
  private final PageCrawler pageCrawler;
  private final SchedulerProperties properties;
  private final ThreadPoolExecutor executor;
  private final AtomicLong sequence = new AtomicLong();

  public CrawlJobScheduler(
      TaskStore taskStore, PageCrawler pageCrawler, SchedulerProperties properties) {
    this.taskStore = taskStore;
    this.pageCrawler = pageCrawler;
    this.properties = properties;
    int workers = properties.getMaxConcurrentTasks();
    this.executor =
        new ThreadPoolExecutor(
            workers,
            workers,
            0L,
            TimeUnit.MILLISECONDS,
            new PriorityBlockingQueue<>(),
            new CustomizableThreadFactory("crawl-worker-"));
    this.executor.prestartAllCoreThreads();
    log.info("Crawl scheduler started with {} workers", workers);
  }

  /**
   * Submit a crawl request.
   *
   * @param request the crawl to run
   * @return identifier of the new pending task
   * @throws UnsupportedFeatureException if the request asks for LLM extraction
   */
  public String submit(CrawlRequest request) {
    if (request.useLlm()) {
      throw new UnsupportedFeatureException("LLM extraction is not supported by this service");
    }
    String taskId = UUID.randomUUID().toString();
    taskStore.create(taskId);
    CrawlJob job = new CrawlJob(taskId, request, sequence.incrementAndGet());
    try {
      executor.execute(new QueuedJob(job));
    } catch (RejectedExecutionException e) {
      log.warn("Scheduler is shutting down, task {} will not run", taskId);
      taskStore.fail(taskId, "Scheduler is shutting down");
      return taskId;
    }
    log.info("Queued task {} for {} (priority {})", taskId, request.firstUrl(), request.priority());
    return taskId;
  }

  /**
   * Current snapshot of a task.
   *
   * @throws TaskNotFoundException if no task has this id
   */
  public Task getStatus(String taskId) {
    return taskStore.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  public long activeTasks() {
    return taskStore.count(TaskStatus.RUNNING);
  }

  public long pendingTasks() {
    return taskStore.count(TaskStatus.PENDING);
  }

  public int maxConcurrentTasks() {
    return properties.getMaxConcurrentTasks();
  }

  void runJob(CrawlJob job) {
    String taskId = job.taskId();
    try {
      taskStore.markRunning(taskId);
    } catch (IllegalStateException | TaskNotFoundException e) {
      log.warn("Skipping job for task {}: {}", taskId, e.getMessage());
      return;
    }

    CrawlRequest request = job.request();
    if (request.urls().size() > 1) {
      log.debug("Task {} carries {} URLs, crawling only {}",
          taskId, request.urls().size(), request.firstUrl());
    }
    try {
      PageCrawlOutcome outcome =
          pageCrawler.crawl(request.firstUrl(), request.toCrawlOptions(), job.sessionId());
      if (outcome.success()) {
        taskStore.complete(taskId, outcome.result());
        log.info("Task {} completed: {}", taskId, request.firstUrl());
      } else {
        taskStore.fail(taskId, outcome.errorMessage());
        log.warn("Task {} failed: {}", taskId, outcome.errorMessage());
      }
    } catch (Exception | StackOverflowError e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      log.error("Task {} failed for {}: {}", taskId, request.firstUrl(), message);
      log.debug("Task {} failure detail", taskId, e);
      failTask(taskId, message);
    }
  }

  private void failTask(String taskId, String message) {
    try {
      taskStore.fail(taskId, message);
    } catch (IllegalStateException | TaskNotFoundException e) {
      log.warn("Could not record failure of task {}: {}", taskId, e.getMessage());
    }
  }

  @PreDestroy
  public void shutdown() {
    List<Runnable> dropped = executor.shutdownNow();
    if (!dropped.isEmpty()) {
      log.info("Dropping {} queued crawl jobs on shutdown", dropped.size());
    }
    try {
      if (!executor.awaitTermination(properties.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
        log.warn("Crawl workers did not stop within {}s", properties.getShutdownTimeoutSeconds());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Queue entry: runs its job and orders like it. */
  private final class QueuedJob implements Runnable, Comparable<QueuedJob> {

    private final CrawlJob job;

    QueuedJob(CrawlJob job) {
      this.job = job;
    }

    @Override
    public void run() {
      runJob(job);
    }

    @Override
    public int compareTo(QueuedJob other) {
      return job.compareTo(other.job);
    }
  }
}
