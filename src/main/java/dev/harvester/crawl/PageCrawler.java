package dev.harvester.crawl;

import dev.harvester.extract.ExtractedPage;
import dev.harvester.extract.ExtractionPipeline;
import dev.harvester.render.PageRenderer;
import dev.harvester.render.RenderedPage;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Renders one URL and runs the extraction pipeline over the result. Shared by the job scheduler
 * and the batch coordinator.
 *
 * <p>A page the renderer could not load yields a failed outcome. Timeouts and transport errors
 * propagate so callers can classify them.
 */
@Service
public class PageCrawler {

  private static final Logger log = LoggerFactory.getLogger(PageCrawler.class);

  private final PageRenderer renderer;
  private final ExtractionPipeline pipeline;
  private final Clock clock;

  public PageCrawler(PageRenderer renderer, ExtractionPipeline pipeline, Clock clock) {
    this.renderer = renderer;
    this.pipeline = pipeline;
    this.clock = clock;
  }

  /**
   * Crawl a single URL.
   *
   * @param url the page to crawl
   * @param options rendering and extraction settings
   * @param sessionId renderer session isolating this crawl from concurrent ones
   * @return the crawl result, or the renderer's error when the page could not be loaded
   */
  public PageCrawlOutcome crawl(String url, CrawlOptions options, @Nullable String sessionId) {
    Instant started = clock.instant();
    RenderedPage page = renderer.render(url, options.renderOptions(sessionId));
    if (!page.success()) {
      String error = page.errorMessage() == null || page.errorMessage().isBlank()
          ? "Rendering failed for " + url
          : page.errorMessage();
      log.debug("Renderer could not load {}: {}", url, error);
      return PageCrawlOutcome.failed(url, error);
    }

    ExtractedPage extracted = pipeline.extract(page, options.schema(), options.filterPolicy());
    long crawlTimeMs = Duration.between(started, clock.instant()).toMillis();
    long pageSize = page.htmlOrEmpty().getBytes(StandardCharsets.UTF_8).length;

    CrawlResult result = new CrawlResult(
        url,
        extracted.title(),
        extracted.rawMarkdown(),
        extracted.fitMarkdown(),
        extracted.markdownWithCitations(),
        extracted.referencesMarkdown(),
        extracted.extracted(),
        extracted.wordCount(),
        page.links(),
        page.images(),
        page.statusCode(),
        new CrawlStats(crawlTimeMs, pageSize));
    log.debug("Crawled {} ({} words, {}ms)", url, result.wordCount(), crawlTimeMs);
    return PageCrawlOutcome.succeeded(result);
  }
}
