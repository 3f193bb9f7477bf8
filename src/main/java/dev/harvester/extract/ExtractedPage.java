package dev.harvester.extract;

import java.util.List;
import java.util.Map;

/**
 * Everything the pipeline derives from one rendered page.
 *
 * @param title document title, or the first heading when the page has none
 * @param rawMarkdown markdown of the whole cleaned body
 * @param fitMarkdown markdown of the body after the content filter
 * @param markdownWithCitations raw markdown with links replaced by citation markers
 * @param referencesMarkdown reference list for the citation markers
 * @param extracted schema extraction output, empty without a schema
 * @param wordCount whitespace token count of the raw markdown
 */
public record ExtractedPage(
    String title,
    String rawMarkdown,
    String fitMarkdown,
    String markdownWithCitations,
    String referencesMarkdown,
    List<Map<String, Object>> extracted,
    int wordCount) {

  public ExtractedPage {
    extracted = extracted == null ? List.of() : List.copyOf(extracted);
  }
}
