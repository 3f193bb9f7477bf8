package dev.harvester.fixture;

import dev.harvester.crawl.CrawlResult;
import dev.harvester.crawl.CrawlStats;
import dev.harvester.render.PageImage;
import dev.harvester.render.PageLink;
import dev.harvester.render.PageLinks;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for {@link CrawlResult} with defaults describing a small successful page, so tests
 * only override what they care about.
 *
 * <pre>{@code
 * CrawlResult result = new CrawlResultBuilder().url("https://blog.example.com/a").build();
 * }</pre>
 */
public final class CrawlResultBuilder {

  private String url = "https://example.com/post";
  private String title = "Example post";
  private String rawMarkdown = "# Example post\n\nSome body text with a [link](https://example.com/a)";
  private @Nullable String fitMarkdown;
  private String referencesMarkdown = "";
  private final List<Map<String, Object>> extractedContent = new ArrayList<>();
  private final List<PageLink> internalLinks = new ArrayList<>();
  private final List<PageLink> externalLinks = new ArrayList<>();
  private final List<PageImage> images = new ArrayList<>();
  private @Nullable Integer statusCode = 200;

  public CrawlResultBuilder url(String url) {
    this.url = url;
    return this;
  }

  public CrawlResultBuilder title(String title) {
    this.title = title;
    return this;
  }

  public CrawlResultBuilder rawMarkdown(String rawMarkdown) {
    this.rawMarkdown = rawMarkdown;
    return this;
  }

  public CrawlResultBuilder fitMarkdown(String fitMarkdown) {
    this.fitMarkdown = fitMarkdown;
    return this;
  }

  public CrawlResultBuilder referencesMarkdown(String referencesMarkdown) {
    this.referencesMarkdown = referencesMarkdown;
    return this;
  }

  public CrawlResultBuilder extractedItem(Map<String, Object> item) {
    this.extractedContent.add(item);
    return this;
  }

  public CrawlResultBuilder internalLink(String href, String text) {
    this.internalLinks.add(new PageLink(href, text, null));
    return this;
  }

  public CrawlResultBuilder externalLink(String href, String text) {
    this.externalLinks.add(new PageLink(href, text, null));
    return this;
  }

  public CrawlResultBuilder image(String src, String alt) {
    this.images.add(new PageImage(src, alt));
    return this;
  }

  public CrawlResultBuilder statusCode(@Nullable Integer statusCode) {
    this.statusCode = statusCode;
    return this;
  }

  public CrawlResult build() {
    String fit = fitMarkdown != null ? fitMarkdown : rawMarkdown;
    return new CrawlResult(
        url,
        title,
        rawMarkdown,
        fit,
        rawMarkdown,
        referencesMarkdown,
        extractedContent,
        rawMarkdown.isBlank() ? 0 : rawMarkdown.strip().split("\\s+").length,
        new PageLinks(internalLinks, externalLinks),
        images,
        statusCode,
        new CrawlStats(12L, rawMarkdown.length()));
  }
}
