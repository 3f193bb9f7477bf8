package dev.harvester.task;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the crawl job scheduler.
 *
 * <p>Properties are bound from {@code harvester.scheduler.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-concurrent-tasks} - number of worker threads, i.e. the most crawl tasks running
 *       at once (default 5, bounded [1, 64])
 *   <li>{@code shutdown-timeout-seconds} - how long shutdown waits for running tasks (default 10)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "harvester.scheduler")
public class SchedulerProperties {

  private int maxConcurrentTasks = 5;
  private int shutdownTimeoutSeconds = 10;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxConcurrentTasks < 1 || maxConcurrentTasks > 64) {
      throw new IllegalStateException(
          "harvester.scheduler.max-concurrent-tasks must be in [1, 64], got: "
              + maxConcurrentTasks);
    }
    if (shutdownTimeoutSeconds < 0) {
      throw new IllegalStateException(
          "harvester.scheduler.shutdown-timeout-seconds must be >= 0, got: "
              + shutdownTimeoutSeconds);
    }
  }

  public int getMaxConcurrentTasks() {
    return maxConcurrentTasks;
  }

  public void setMaxConcurrentTasks(int maxConcurrentTasks) {
    this.maxConcurrentTasks = maxConcurrentTasks;
  }

  public int getShutdownTimeoutSeconds() {
    return shutdownTimeoutSeconds;
  }

  public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
    this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
  }
}
