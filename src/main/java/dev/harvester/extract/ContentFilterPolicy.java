package dev.harvester.extract;

import org.jspecify.annotations.Nullable;

/**
 * Which content filter produces the fit markdown, with its threshold and, for BM25, its query.
 */
public record ContentFilterPolicy(FilterType type, double threshold, @Nullable String query) {

  public static final double DEFAULT_THRESHOLD = 0.5;

  public ContentFilterPolicy {
    type = type == null ? FilterType.PRUNING : type;
  }

  public static ContentFilterPolicy pruning(double threshold) {
    return new ContentFilterPolicy(FilterType.PRUNING, threshold, null);
  }

  public static ContentFilterPolicy bm25(@Nullable String query, double threshold) {
    return new ContentFilterPolicy(FilterType.BM25, threshold, query);
  }

  public static ContentFilterPolicy none() {
    return new ContentFilterPolicy(FilterType.NONE, DEFAULT_THRESHOLD, null);
  }
}
