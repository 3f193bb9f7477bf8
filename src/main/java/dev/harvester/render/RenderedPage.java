package dev.harvester.render;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * What the browser produced for one URL: the rendered HTML, discovered links and images, or the
 * browser's error message when the page could not be loaded.
 */
public record RenderedPage(
    String url,
    boolean success,
    @Nullable String html,
    PageLinks links,
    List<PageImage> images,
    @Nullable Integer statusCode,
    @Nullable String errorMessage) {

  public RenderedPage {
    links = links == null ? PageLinks.empty() : links;
    images = images == null ? List.of() : List.copyOf(images);
  }

  public static RenderedPage failed(String url, @Nullable String errorMessage) {
    return new RenderedPage(url, false, null, PageLinks.empty(), List.of(), null, errorMessage);
  }

  /** The HTML of a successful render, never null. */
  public String htmlOrEmpty() {
    return html == null ? "" : html;
  }
}
