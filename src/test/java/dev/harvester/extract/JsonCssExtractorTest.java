package dev.harvester.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class JsonCssExtractorTest {

  private static final String BLOG_POST =
      "<html><body>"
          + "<h1>Release notes</h1>"
          + "<span class=\"posted-on\"><time datetime=\"2024-05-01\">May 1, 2024</time></span>"
          + "<div class=\"entry-content\"><p>Body</p></div>"
          + "<span class=\"cat-links\"><a href=\"/c/news\">News</a><a href=\"/c/tech\">Tech</a></span>"
          + "<a class=\"author\" href=\"/u/ada\">Ada</a>"
          + "</body></html>";

  private static final ExtractionSchema BLOG_SCHEMA =
      new ExtractionSchema(
          "Blog Posts",
          "body",
          List.of(
              SchemaField.text("title", "h1"),
              SchemaField.html("content", ".entry-content"),
              SchemaField.text("date", ".posted-on time"),
              SchemaField.list(
                  "categories", ".cat-links a", List.of(SchemaField.text("category", null))),
              SchemaField.list("tags", ".tags-links a", List.of(SchemaField.text("tag", null))),
              SchemaField.nested(
                  "author",
                  "a.author",
                  List.of(
                      SchemaField.text("name", null),
                      SchemaField.attribute("profile", null, "href")))));

  private final JsonCssExtractor extractor = new JsonCssExtractor();

  private static Document parse(String html) {
    return Jsoup.parse(html, "https://example.com/post");
  }

  @Test
  void extractsOneItemPerBaseMatchWithAllFieldKinds() {
    List<Map<String, Object>> items = extractor.extract(parse(BLOG_POST), BLOG_SCHEMA);

    assertThat(items).hasSize(1);
    Map<String, Object> item = items.get(0);
    assertThat(item).containsEntry("title", "Release notes");
    assertThat(item).containsEntry("date", "May 1, 2024");
    assertThat((String) item.get("content")).contains("<p>Body</p>");
    assertThat(item)
        .containsEntry(
            "categories", List.of(Map.of("category", "News"), Map.of("category", "Tech")));
    assertThat(item).containsEntry("author", Map.of("name", "Ada", "profile", "/u/ada"));
  }

  @Test
  void missingMatchesFallBackToKindDefaults() {
    List<Map<String, Object>> items = extractor.extract(parse(BLOG_POST), BLOG_SCHEMA);

    assertThat(items.get(0)).containsEntry("tags", List.of());

    ExtractionSchema schema =
        new ExtractionSchema(
            "defaults",
            "body",
            List.of(
                SchemaField.text("missingText", ".nope"),
                SchemaField.nested("missingNested", ".nope", List.of()),
                new SchemaField("withDefault", ".nope", FieldKind.TEXT, null, "n/a", List.of())));
    Map<String, Object> item = extractor.extract(parse("<p>x</p>"), schema).get(0);

    assertThat(item)
        .containsEntry("missingText", "")
        .containsEntry("missingNested", Map.of())
        .containsEntry("withDefault", "n/a");
  }

  @Test
  void baseSelectorMatchingSeveralElementsYieldsSeveralItemsInDocumentOrder() {
    String html =
        "<div class=\"card\"><h2>First</h2></div><div class=\"card\"><h2>Second</h2></div>";
    ExtractionSchema schema =
        new ExtractionSchema("cards", ".card", List.of(SchemaField.text("heading", "h2")));

    List<Map<String, Object>> items = extractor.extract(parse(html), schema);

    assertThat(items).containsExactly(Map.of("heading", "First"), Map.of("heading", "Second"));
  }

  @Test
  void invalidSelectorIsTreatedAsNoMatch() {
    ExtractionSchema schema =
        new ExtractionSchema("broken", "body", List.of(SchemaField.text("title", "h1[")));

    List<Map<String, Object>> items = extractor.extract(parse(BLOG_POST), schema);

    assertThat(items).containsExactly(Map.of("title", ""));
  }

  @Test
  void invalidBaseSelectorYieldsNoItems() {
    ExtractionSchema schema =
        new ExtractionSchema("broken", "div[", List.of(SchemaField.text("title", "h1")));

    assertThat(extractor.extract(parse(BLOG_POST), schema)).isEmpty();
  }

  @Test
  void missingAttributeFallsBackToDefault() {
    ExtractionSchema schema =
        new ExtractionSchema(
            "attr", "body", List.of(SchemaField.attribute("published", "time", "data-missing")));

    assertThat(extractor.extract(parse(BLOG_POST), schema))
        .containsExactly(Map.of("published", ""));
  }
}
