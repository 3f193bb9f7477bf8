package dev.harvester.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;

/**
 * Envelope returned by the sidecar's {@code /crawl} endpoint. A single URL is sent per request, so
 * only the first result is ever consulted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiResponse(boolean success, List<Crawl4AiPageResult> results) {

  public Crawl4AiResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /** The page result for the requested URL, or empty when the sidecar reported nothing usable. */
  Optional<Crawl4AiPageResult> pageResult() {
    if (!success || results.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(results.get(0));
  }
}
