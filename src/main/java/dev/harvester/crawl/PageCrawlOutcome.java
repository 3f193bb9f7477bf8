package dev.harvester.crawl;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one page crawl: a result when the renderer succeeded, otherwise the renderer's error
 * text.
 */
public record PageCrawlOutcome(
    String url, @Nullable CrawlResult result, @Nullable String errorMessage) {

  public static PageCrawlOutcome succeeded(CrawlResult result) {
    return new PageCrawlOutcome(result.url(), result, null);
  }

  public static PageCrawlOutcome failed(String url, String errorMessage) {
    return new PageCrawlOutcome(url, null, errorMessage);
  }

  public boolean success() {
    return result != null;
  }
}
