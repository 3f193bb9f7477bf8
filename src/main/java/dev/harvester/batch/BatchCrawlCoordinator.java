package dev.harvester.batch;

import dev.harvester.crawl.CrawlOptions;
import dev.harvester.crawl.PageCrawlOutcome;
import dev.harvester.crawl.PageCrawler;
import dev.harvester.render.RenderTimeoutException;
import dev.harvester.sink.ErrorRecord;
import dev.harvester.sink.FailureKind;
import dev.harvester.sink.ResultRecord;
import dev.harvester.sink.ResultSink;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Crawls a URL list in consecutive batches.
 *
 * <p>Every URL of a batch is crawled concurrently in its own renderer session. The batch settles
 * completely, with one outcome per URL whatever its siblings did, before its records are handed
 * to the sink. Only then, after the configured cool-down, does the next batch start.
 */
@Service
public class BatchCrawlCoordinator {

  private static final Logger log = LoggerFactory.getLogger(BatchCrawlCoordinator.class);

  private final PageCrawler pageCrawler;
  private final CrawlOptions defaultOptions;
  private final Duration batchDelay;
  private final Clock clock;

  public BatchCrawlCoordinator(
      PageCrawler pageCrawler,
      @Qualifier("batchCrawlOptions") CrawlOptions defaultOptions,
      BatchProperties properties,
      Clock clock) {
    this.pageCrawler = pageCrawler;
    this.defaultOptions = defaultOptions;
    this.batchDelay = properties.batchDelay();
    this.clock = clock;
  }

  /**
   * Crawl {@code urls} with the bulk-run crawl options.
   *
   * @see #crawlParallel(List, ResultSink, int, CrawlOptions)
   */
  public BatchStats crawlParallel(List<String> urls, ResultSink sink, int maxConcurrent)
      throws InterruptedException {
    return crawlParallel(urls, sink, maxConcurrent, defaultOptions);
  }

  /**
   * Crawl {@code urls} in batches of {@code maxConcurrent}.
   *
   * @param urls pages to crawl, in batch order
   * @param sink receives one result or error record per URL
   * @param maxConcurrent batch size and number of concurrent renders
   * @param options rendering and extraction settings for every page
   * @return counters over all batches
   * @throws InterruptedException if interrupted during the cool-down or while a batch runs
   */
  public BatchStats crawlParallel(
      List<String> urls, ResultSink sink, int maxConcurrent, CrawlOptions options)
      throws InterruptedException {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be >= 1, got: " + maxConcurrent);
    }
    int batchCount = (urls.size() + maxConcurrent - 1) / maxConcurrent;
    log.info("Crawling {} URLs in {} batches of up to {}", urls.size(), batchCount, maxConcurrent);

    BatchStats stats = BatchStats.empty();
    ExecutorService pool =
        Executors.newFixedThreadPool(maxConcurrent, new CustomizableThreadFactory("batch-crawl-"));
    try {
      for (int start = 0; start < urls.size(); start += maxConcurrent) {
        if (start > 0 && !batchDelay.isZero()) {
          Thread.sleep(batchDelay.toMillis());
        }
        List<String> batch = urls.subList(start, Math.min(start + maxConcurrent, urls.size()));
        List<ItemOutcome> outcomes = runBatch(batch, start, options, pool);

        stats = stats.nextBatch();
        for (ItemOutcome outcome : outcomes) {
          stats = stats.record(outcome.failure());
          persist(outcome, sink);
        }
        log.info(
            "Batch {}/{} done (success={}, failed={}, timeout={}, error={})",
            stats.batches(),
            batchCount,
            stats.success(),
            stats.failed(),
            stats.timeout(),
            stats.error());
      }
    } finally {
      pool.shutdownNow();
    }
    return stats;
  }

  private List<ItemOutcome> runBatch(
      List<String> batch, int firstIndex, CrawlOptions options, ExecutorService pool)
      throws InterruptedException {
    List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      String url = batch.get(i);
      String sessionId = "session_" + (firstIndex + i);
      futures.add(
          CompletableFuture.supplyAsync(() -> crawlItem(url, options, sessionId), pool)
              .handle((outcome, failure) -> failure == null ? outcome : fromException(url, failure)));
    }

    List<ItemOutcome> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<ItemOutcome> future : futures) {
      try {
        outcomes.add(future.get());
      } catch (ExecutionException e) {
        // handle() above turns every failure into an outcome
        throw new IllegalStateException("Unsettled batch item", e);
      }
    }
    return outcomes;
  }

  private ItemOutcome crawlItem(String url, CrawlOptions options, String sessionId) {
    PageCrawlOutcome outcome = pageCrawler.crawl(url, options, sessionId);
    if (!outcome.success()) {
      log.warn("Failed to crawl {}: {}", url, outcome.errorMessage());
      return failure(url, FailureKind.FAILED, outcome.errorMessage());
    }
    ResultRecord record = ResultRecord.from(outcome.result(), clock.instant());
    log.debug("Crawled {}", url);
    return new ItemOutcome(url, null, record, null);
  }

  private ItemOutcome fromException(String url, Throwable failure) {
    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
        ? failure.getCause()
        : failure;
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    if (isTimeout(cause)) {
      log.warn("Timeout crawling {}: {}", url, message);
      return failure(url, FailureKind.TIMEOUT, message);
    }
    log.error("Error crawling {}: {}", url, message);
    return failure(url, FailureKind.ERROR, message);
  }

  static boolean isTimeout(Throwable cause) {
    if (cause instanceof RenderTimeoutException) {
      return true;
    }
    String message = cause.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains("timeout");
  }

  private ItemOutcome failure(String url, FailureKind kind, @Nullable String message) {
    String error = message == null ? kind.wireName() : message;
    return new ItemOutcome(url, kind, null, new ErrorRecord(url, clock.instant(), kind, error));
  }

  private static void persist(ItemOutcome outcome, ResultSink sink) {
    if (outcome.record() != null) {
      sink.writeResult(outcome.record());
    } else if (outcome.error() != null) {
      sink.writeError(outcome.error());
    }
  }

  /** Settled outcome of one URL: a result record, or a failure kind with its error record. */
  private record ItemOutcome(
      String url,
      @Nullable FailureKind failure,
      @Nullable ResultRecord record,
      @Nullable ErrorRecord error) {}
}
