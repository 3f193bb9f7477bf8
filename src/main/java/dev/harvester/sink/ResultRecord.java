package dev.harvester.sink;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.harvester.crawl.CrawlResult;
import dev.harvester.render.PageLinks;
import java.time.Instant;
import java.util.Map;

/**
 * One line of {@code results.jsonl}: the persisted form of a successful crawl.
 *
 * @param url crawled URL
 * @param timestamp when the outcome was processed
 * @param content title and markdown
 * @param metadata word count and the first structured item
 * @param links internal and external links
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResultRecord(
    String url, Instant timestamp, Content content, Metadata metadata, PageLinks links) {

  public ResultRecord {
    links = links == null ? PageLinks.empty() : links;
  }

  public static ResultRecord from(CrawlResult result, Instant timestamp) {
    Map<String, Object> fields =
        result.extractedContent().isEmpty() ? Map.of() : result.extractedContent().get(0);
    return new ResultRecord(
        result.url(),
        timestamp,
        new Content(
            result.title(),
            result.rawMarkdown(),
            result.fitMarkdown(),
            result.referencesMarkdown()),
        new Metadata(result.wordCount(), fields),
        result.links());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Content(String title, String rawMarkdown, String fitMarkdown, String references) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Metadata(int wordCount, Map<String, Object> fields) {
    public Metadata {
      fields = fields == null ? Map.of() : fields;
    }
  }
}
