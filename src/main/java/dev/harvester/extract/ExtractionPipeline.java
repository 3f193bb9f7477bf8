package dev.harvester.extract;

import dev.harvester.render.RenderedPage;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns rendered HTML into markdown and structured data.
 *
 * <p>The output is a pure function of the page HTML, its URL, the schema and the filter policy.
 */
@Component
public class ExtractionPipeline {

  private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

  private static final String NON_CONTENT_TAGS =
      "script, style, noscript, template, iframe, svg, canvas, object, embed";

  private final ExtractionProperties properties;
  private final MarkdownGenerator markdownGenerator = new MarkdownGenerator();
  private final JsonCssExtractor cssExtractor = new JsonCssExtractor();

  public ExtractionPipeline(ExtractionProperties properties) {
    this.properties = properties;
  }

  public ExtractedPage extract(
      RenderedPage page, @Nullable ExtractionSchema schema, ContentFilterPolicy policy) {
    Document document = Jsoup.parse(page.htmlOrEmpty(), page.url());
    Element body = cleanBody(document);

    MarkdownResult raw = markdownGenerator.generate(body);
    String fitMarkdown =
        policy.type() == FilterType.NONE
            ? raw.markdown()
            : markdownGenerator.generate(filterFor(policy).apply(body)).markdown();

    List<Map<String, Object>> extracted =
        schema == null ? List.of() : cssExtractor.extract(document, schema);

    log.debug(
        "Extracted {}: {} raw chars, {} fit chars, {} schema items",
        page.url(),
        raw.markdown().length(),
        fitMarkdown.length(),
        extracted.size());

    return new ExtractedPage(
        title(document),
        raw.markdown(),
        fitMarkdown,
        raw.markdownWithCitations(),
        raw.referencesMarkdown(),
        extracted,
        WordCounter.count(raw.markdown()));
  }

  ContentFilter filterFor(ContentFilterPolicy policy) {
    return switch (policy.type()) {
      case PRUNING -> new PruningContentFilter(policy.threshold(), properties.pruningMinWords());
      case BM25 -> {
        if (policy.query() == null || policy.query().isBlank()) {
          log.debug("BM25 filter requested without a query, keeping the full content");
          yield ContentFilter.none();
        }
        yield new Bm25ContentFilter(policy.query(), policy.threshold());
      }
      case NONE -> ContentFilter.none();
    };
  }

  static Element cleanBody(Document document) {
    Element body = document.body().clone();
    body.setBaseUri(document.location());
    body.select(NON_CONTENT_TAGS).remove();
    return body;
  }

  private static String title(Document document) {
    String title = document.title().trim();
    if (!title.isEmpty()) {
      return title;
    }
    Element heading = document.selectFirst("h1");
    return heading == null ? "" : heading.text().trim();
  }
}
