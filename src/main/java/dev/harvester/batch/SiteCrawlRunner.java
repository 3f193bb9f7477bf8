package dev.harvester.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.harvester.sink.JsonLinesResultSink;
import dev.harvester.sink.RunDirectories;
import dev.harvester.sitemap.SitemapResolver;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Bulk crawl of one site at startup, enabled with {@code harvester.batch.enabled}.
 *
 * <p>Discovers the site's URLs from its sitemaps, crawls them in batches into a fresh run
 * directory ({@code results.jsonl}, {@code errors.jsonl}) and finishes with a {@code stats.json}
 * summary.
 */
@Component
public class SiteCrawlRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SiteCrawlRunner.class);

  static final String STATS_FILE = "stats.json";

  private final BatchProperties properties;
  private final SitemapResolver sitemapResolver;
  private final BatchCrawlCoordinator coordinator;
  private final RunDirectories runDirectories;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ConfigurableApplicationContext applicationContext;

  public SiteCrawlRunner(
      BatchProperties properties,
      SitemapResolver sitemapResolver,
      BatchCrawlCoordinator coordinator,
      RunDirectories runDirectories,
      ObjectMapper objectMapper,
      Clock clock,
      ConfigurableApplicationContext applicationContext) {
    this.properties = properties;
    this.sitemapResolver = sitemapResolver;
    this.coordinator = coordinator;
    this.runDirectories = runDirectories;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.applicationContext = applicationContext;
  }

  @Override
  public void run(ApplicationArguments args) throws IOException, InterruptedException {
    if (!properties.enabled()) {
      return;
    }
    String baseUrl = properties.baseUrl();
    if (baseUrl == null || baseUrl.isBlank()) {
      log.warn("Bulk crawl enabled but harvester.batch.base-url is not set, skipping");
      return;
    }

    RunSummary summary = crawlSite(baseUrl);
    if (summary != null) {
      BatchStats stats = summary.stats();
      log.info(
          "Bulk crawl of {} finished: {} URLs, success={}, failed={}, timeout={}, error={}",
          baseUrl,
          summary.discoveredUrls(),
          stats.success(),
          stats.failed(),
          stats.timeout(),
          stats.error());
    }

    if (properties.exitOnCompletion()) {
      int exitCode = SpringApplication.exit(applicationContext, () -> 0);
      System.exit(exitCode);
    }
  }

  /**
   * Discover and crawl one site.
   *
   * @return the run summary, or null when the site's sitemaps list no URLs
   */
  @Nullable RunSummary crawlSite(String baseUrl) throws IOException, InterruptedException {
    log.info("Discovering URLs from sitemaps of {}", baseUrl);
    Set<String> discovered = sitemapResolver.discover(baseUrl);
    if (discovered.isEmpty()) {
      log.warn("No URLs found in the sitemaps of {}", baseUrl);
      return null;
    }
    List<String> urls = new ArrayList<>(discovered);
    Collections.sort(urls);

    Path runDirectory = runDirectories.create();
    log.info("Crawling {} URLs from {} into {}", urls.size(), baseUrl, runDirectory);
    JsonLinesResultSink sink = new JsonLinesResultSink(runDirectory, objectMapper);

    Instant startedAt = clock.instant();
    BatchStats stats = coordinator.crawlParallel(urls, sink, properties.maxConcurrent());
    RunSummary summary = new RunSummary(baseUrl, urls.size(), startedAt, clock.instant(), stats);

    objectMapper
        .writerWithDefaultPrettyPrinter()
        .writeValue(runDirectory.resolve(STATS_FILE).toFile(), summary);
    return summary;
  }
}
