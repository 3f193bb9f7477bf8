package dev.harvester.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** Per-page result within a {@link Crawl4AiResponse}: rendered HTML, links and media. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Crawl4AiPageResult(
    String url,
    boolean success,
    @Nullable Integer statusCode,
    @Nullable String html,
    @Nullable String cleanedHtml,
    @Nullable Map<String, List<Crawl4AiLink>> links,
    @Nullable Map<String, List<Crawl4AiMedia>> media,
    @Nullable String errorMessage) {
  public Crawl4AiPageResult {
    links = links == null ? Map.of() : copyOf(links);
    media = media == null ? Map.of() : copyOf(media);
  }

  /** The full rendered DOM, falling back to the sidecar's cleaned variant. */
  public @Nullable String bestHtml() {
    if (html != null && !html.isBlank()) {
      return html;
    }
    return cleanedHtml;
  }

  public List<PageLink> linksOfKind(String kind) {
    if (links == null) {
      return List.of();
    }
    return links.getOrDefault(kind, List.of()).stream()
        .filter(Crawl4AiLink::hasHref)
        .map(Crawl4AiLink::toPageLink)
        .toList();
  }

  public List<PageImage> images() {
    if (media == null) {
      return List.of();
    }
    return media.getOrDefault("images", List.of()).stream()
        .filter(image -> image.src() != null && !image.src().isBlank())
        .map(image -> new PageImage(image.src(), image.alt()))
        .toList();
  }

  private static <T> Map<String, List<T>> copyOf(Map<String, List<T>> source) {
    return source.entrySet().stream()
        .filter(e -> e.getKey() != null && e.getValue() != null)
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
  }
}
