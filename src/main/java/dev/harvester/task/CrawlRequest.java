package dev.harvester.task;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.harvester.crawl.CrawlOptions;
import dev.harvester.extract.ContentFilterPolicy;
import dev.harvester.extract.ExtractionSchema;
import dev.harvester.extract.FilterType;
import dev.harvester.extract.SchemaParser;
import dev.harvester.render.WaitCondition;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A crawl submission. {@code urls} accepts a single string or an array; every other field has a
 * default.
 *
 * @param urls target URLs; only the first one is crawled
 * @param priority 1..10, higher runs first (default 1)
 * @param useLlm LLM-based extraction, always rejected at submission
 * @param customSchema CSS extraction schema in its JSON form
 * @param searchQuery query for the BM25 content filter
 * @param extractJson whether to run structured extraction (default true)
 * @param contentFilter content filter for the fit markdown (default pruning)
 * @param filterThreshold filter threshold (default 0.5)
 * @param waitFor load condition (default domcontentloaded)
 * @param pageTimeout page timeout in ms, 1000..60000 (default 30000)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CrawlRequest(
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> urls,
    Integer priority,
    Boolean useLlm,
    @Nullable Map<String, Object> customSchema,
    @Nullable String searchQuery,
    Boolean extractJson,
    FilterType contentFilter,
    Double filterThreshold,
    WaitCondition waitFor,
    Integer pageTimeout) {

  public static final int MIN_PRIORITY = 1;
  public static final int MAX_PRIORITY = 10;
  public static final int MIN_PAGE_TIMEOUT_MS = 1_000;
  public static final int MAX_PAGE_TIMEOUT_MS = 60_000;
  /** Upper bound actually handed to the renderer. */
  public static final int RENDER_TIMEOUT_CAP_MS = 30_000;

  public CrawlRequest {
    if (urls == null || urls.isEmpty()) {
      throw new IllegalArgumentException("urls must contain at least one URL");
    }
    for (String url : urls) {
      if (url == null || url.isBlank()) {
        throw new IllegalArgumentException("urls must not contain blank entries");
      }
    }
    urls = List.copyOf(urls);
    priority = priority == null ? MIN_PRIORITY : priority;
    if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
      throw new IllegalArgumentException(
          "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ", got: " + priority);
    }
    useLlm = useLlm != null && useLlm;
    extractJson = extractJson == null || extractJson;
    contentFilter = contentFilter == null ? FilterType.PRUNING : contentFilter;
    filterThreshold = filterThreshold == null ? ContentFilterPolicy.DEFAULT_THRESHOLD : filterThreshold;
    waitFor = waitFor == null ? WaitCondition.DOMCONTENTLOADED : waitFor;
    pageTimeout = pageTimeout == null ? CrawlOptions.DEFAULT_PAGE_TIMEOUT_MS : pageTimeout;
    if (pageTimeout < MIN_PAGE_TIMEOUT_MS || pageTimeout > MAX_PAGE_TIMEOUT_MS) {
      throw new IllegalArgumentException(
          "page_timeout must be between " + MIN_PAGE_TIMEOUT_MS + " and " + MAX_PAGE_TIMEOUT_MS
              + " ms, got: " + pageTimeout);
    }
  }

  /** Single-URL request with every other field at its default. */
  public static CrawlRequest of(String url) {
    return new CrawlRequest(List.of(url), null, null, null, null, null, null, null, null, null);
  }

  public String firstUrl() {
    return urls.get(0);
  }

  public int effectivePageTimeoutMs() {
    return Math.min(pageTimeout, RENDER_TIMEOUT_CAP_MS);
  }

  public CrawlOptions toCrawlOptions() {
    ExtractionSchema schema =
        extractJson && customSchema != null ? SchemaParser.parse(customSchema) : null;
    return new CrawlOptions(
        new ContentFilterPolicy(contentFilter, filterThreshold, searchQuery),
        schema,
        waitFor,
        effectivePageTimeoutMs());
  }
}
