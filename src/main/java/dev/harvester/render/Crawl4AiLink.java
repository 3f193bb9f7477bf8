package dev.harvester.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** One entry of the sidecar's {@code links.internal} or {@code links.external} lists. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiLink(@Nullable String href, @Nullable String text, @Nullable String title) {

  /** Anchors without a target (javascript handlers, bare fragments stripped upstream). */
  boolean hasHref() {
    return href != null && !href.isBlank();
  }

  PageLink toPageLink() {
    return new PageLink(href, text, title);
  }
}
