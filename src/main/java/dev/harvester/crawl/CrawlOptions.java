package dev.harvester.crawl;

import dev.harvester.extract.ContentFilterPolicy;
import dev.harvester.extract.ExtractionSchema;
import dev.harvester.render.RenderOptions;
import dev.harvester.render.WaitCondition;
import org.jspecify.annotations.Nullable;

/**
 * How one page is crawled: browser settings plus extraction settings.
 *
 * @param filterPolicy content filter producing the fit markdown
 * @param schema structured extraction schema, or null to skip structured extraction
 * @param waitUntil load condition to wait for
 * @param pageTimeoutMs page timeout handed to the renderer
 */
public record CrawlOptions(
    ContentFilterPolicy filterPolicy,
    @Nullable ExtractionSchema schema,
    WaitCondition waitUntil,
    int pageTimeoutMs) {

  public static final int DEFAULT_PAGE_TIMEOUT_MS = 30_000;

  public CrawlOptions {
    filterPolicy = filterPolicy == null ? ContentFilterPolicy.pruning(0.5) : filterPolicy;
    waitUntil = waitUntil == null ? WaitCondition.DOMCONTENTLOADED : waitUntil;
  }

  public static CrawlOptions defaults() {
    return new CrawlOptions(
        ContentFilterPolicy.pruning(ContentFilterPolicy.DEFAULT_THRESHOLD),
        null,
        WaitCondition.DOMCONTENTLOADED,
        DEFAULT_PAGE_TIMEOUT_MS);
  }

  /** Renderer settings for one render; {@code networkidle0} is downgraded to DOM-content-loaded. */
  public RenderOptions renderOptions(@Nullable String sessionId) {
    return new RenderOptions(pageTimeoutMs, waitUntil.effective(), sessionId);
  }
}
