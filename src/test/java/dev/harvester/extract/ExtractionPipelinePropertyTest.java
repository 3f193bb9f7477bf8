package dev.harvester.extract;

import static org.assertj.core.api.Assertions.assertThat;

import dev.harvester.render.PageLinks;
import dev.harvester.render.RenderedPage;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;

class ExtractionPipelinePropertyTest {

  private final ExtractionPipeline pipeline = new ExtractionPipeline(new ExtractionProperties(5));

  @Property(tries = 200)
  void pruningNeverAddsWords(
      @ForAll("pages") String html, @ForAll @DoubleRange(min = 0.0, max = 2.0) double threshold) {
    ExtractedPage page = pipeline.extract(page(html), null, ContentFilterPolicy.pruning(threshold));

    assertThat(WordCounter.count(page.fitMarkdown())).isLessThanOrEqualTo(page.wordCount());
  }

  @Property(tries = 100)
  void bm25NeverAddsWords(@ForAll("pages") String html, @ForAll("queries") String query) {
    ExtractedPage page = pipeline.extract(page(html), null, ContentFilterPolicy.bm25(query, 0.5));

    assertThat(WordCounter.count(page.fitMarkdown())).isLessThanOrEqualTo(page.wordCount());
  }

  @Property(tries = 100)
  void extractionIsDeterministic(@ForAll("pages") String html) {
    ExtractedPage first = pipeline.extract(page(html), null, ContentFilterPolicy.pruning(0.5));
    ExtractedPage second = pipeline.extract(page(html), null, ContentFilterPolicy.pruning(0.5));

    assertThat(second).isEqualTo(first);
  }

  private static RenderedPage page(String html) {
    return new RenderedPage(
        "https://example.com/page", true, html, PageLinks.empty(), List.of(), 200, null);
  }

  @Provide
  Arbitrary<String> queries() {
    return words().list().ofMinSize(1).ofMaxSize(3).map(terms -> String.join(" ", terms));
  }

  @Provide
  Arbitrary<String> pages() {
    return block(3).list().ofMaxSize(6).map(blocks -> "<body>" + String.join("", blocks) + "</body>");
  }

  private static Arbitrary<String> words() {
    return Arbitraries.of(
        "crawl", "page", "render", "queue", "worker", "sitemap", "markdown", "filter", "link", "the");
  }

  private static Arbitrary<String> text() {
    return words().list().ofMinSize(1).ofMaxSize(20).map(terms -> String.join(" ", terms));
  }

  private static Arbitrary<String> leaf() {
    Arbitrary<String> tag = Arbitraries.of("p", "h1", "h2", "li", "span", "blockquote", "td");
    Arbitrary<String> link =
        text().map(label -> "<a href=\"/" + label.length() + "\">" + label + "</a>");
    Arbitrary<String> content = Arbitraries.oneOf(text(), link);
    return Combinators.combine(tag, content, content)
        .as((name, first, second) -> "<" + name + ">" + first + " " + second + "</" + name + ">");
  }

  private static Arbitrary<String> block(int depth) {
    if (depth == 0) {
      return leaf();
    }
    Arbitrary<String> container =
        Arbitraries.of("div", "section", "article", "ul", "nav", "footer", "table");
    Arbitrary<String> nested =
        Combinators.combine(container, block(depth - 1).list().ofMinSize(1).ofMaxSize(3))
            .as((name, children) -> "<" + name + ">" + String.join("", children) + "</" + name + ">");
    return Arbitraries.oneOf(leaf(), nested);
  }
}
