package dev.harvester.crawl;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.harvester.render.PageImage;
import dev.harvester.render.PageLinks;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Result of crawling a single URL: markdown variants, extracted items, links and stats. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CrawlResult(
    String url,
    String title,
    String rawMarkdown,
    String fitMarkdown,
    String markdownWithCitations,
    String referencesMarkdown,
    List<Map<String, Object>> extractedContent,
    int wordCount,
    PageLinks links,
    List<PageImage> images,
    @Nullable Integer statusCode,
    CrawlStats stats) {
  public CrawlResult {
    extractedContent = extractedContent == null ? List.of() : List.copyOf(extractedContent);
    links = links == null ? PageLinks.empty() : links;
    images = images == null ? List.of() : List.copyOf(images);
  }
}
