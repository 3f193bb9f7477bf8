package dev.harvester.sitemap;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Sitemap discovery settings bound from {@code harvester.sitemap.*}.
 *
 * @param candidatePaths conventional sitemap locations, tried in order against the site root
 * @param maxSitemapSizeBytes sitemaps larger than this are skipped
 * @param maxDepth how many levels of nested sitemap indexes are followed
 * @param indexPolicy what happens to page URLs listed next to sub-sitemaps in an index
 */
@ConfigurationProperties(prefix = "harvester.sitemap")
public record SitemapProperties(
    @DefaultValue({"/sitemap.xml", "/sitemap_index.xml", "/sitemap/sitemap.xml", "/wp-sitemap.xml"})
        List<String> candidatePaths,
    @DefaultValue("10485760") long maxSitemapSizeBytes,
    @DefaultValue("3") int maxDepth,
    @DefaultValue("any-xml-forces-index") IndexPolicy indexPolicy) {

  public SitemapProperties {
    candidatePaths = candidatePaths == null ? List.of() : List.copyOf(candidatePaths);
    indexPolicy = indexPolicy == null ? IndexPolicy.ANY_XML_FORCES_INDEX : indexPolicy;
    if (maxDepth < 1) {
      throw new IllegalArgumentException("harvester.sitemap.max-depth must be >= 1, got: " + maxDepth);
    }
  }

  /** Defaults used outside a Spring context. */
  public static SitemapProperties defaults() {
    return new SitemapProperties(
        List.of("/sitemap.xml", "/sitemap_index.xml", "/sitemap/sitemap.xml", "/wp-sitemap.xml"),
        10_485_760L,
        3,
        IndexPolicy.ANY_XML_FORCES_INDEX);
  }

  /**
   * How a sitemap that lists at least one {@code .xml} location is read.
   */
  public enum IndexPolicy {
    /** The whole file is an index: only its {@code .xml} entries are followed, page URLs next to them are dropped. */
    ANY_XML_FORCES_INDEX,
    /** {@code .xml} entries are followed and the remaining entries are kept as page URLs. */
    MIXED
  }
}
