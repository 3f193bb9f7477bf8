package dev.harvester.task;

import java.util.Comparator;

/**
 * A queued crawl: the task it belongs to, the request, and its submission sequence number. Jobs
 * order by priority, highest first, then by submission order.
 */
record CrawlJob(String taskId, CrawlRequest request, long sequence)
    implements Comparable<CrawlJob> {

  private static final Comparator<CrawlJob> ORDER =
      Comparator.comparingInt((CrawlJob job) -> job.request().priority())
          .reversed()
          .thenComparingLong(CrawlJob::sequence);

  @Override
  public int compareTo(CrawlJob other) {
    return ORDER.compare(this, other);
  }

  String sessionId() {
    return "task_" + taskId;
  }
}
