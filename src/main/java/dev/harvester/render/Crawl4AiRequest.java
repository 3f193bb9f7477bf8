package dev.harvester.render;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

/**
 * Body of a sidecar {@code /crawl} call for exactly one URL. Both config maps use the sidecar's
 * typed envelope: {@code {"type": "BrowserConfig", "params": {...}}}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Crawl4AiRequest(
    List<String> urls, Map<String, Object> browserConfig, Map<String, Object> crawlerConfig) {

  public Crawl4AiRequest {
    urls = List.copyOf(urls);
    browserConfig = Map.copyOf(browserConfig);
    crawlerConfig = Map.copyOf(crawlerConfig);
  }

  static Crawl4AiRequest forUrl(
      String url, Map<String, Object> browserParams, Map<String, Object> crawlerParams) {
    return new Crawl4AiRequest(
        List.of(url),
        Map.of("type", "BrowserConfig", "params", Map.copyOf(browserParams)),
        Map.of("type", "CrawlerRunConfig", "params", Map.copyOf(crawlerParams)));
  }

  @SuppressWarnings("unchecked")
  Map<String, Object> browserParams() {
    return (Map<String, Object>) browserConfig.getOrDefault("params", Map.of());
  }

  @SuppressWarnings("unchecked")
  Map<String, Object> crawlerParams() {
    return (Map<String, Object>) crawlerConfig.getOrDefault("params", Map.of());
  }
}
