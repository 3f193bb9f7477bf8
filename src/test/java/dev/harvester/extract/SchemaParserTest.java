package dev.harvester.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SchemaParserTest {

  @Test
  void parsesNestedFieldsWithTypesAndDefaults() {
    Map<String, Object> json =
        Map.of(
            "name", "Blog Posts",
            "baseSelector", "article",
            "fields",
                List.of(
                    Map.of("name", "title", "selector", "h1", "type", "text", "default", "untitled"),
                    Map.of("name", "link", "selector", "a", "type", "attribute", "attribute", "href"),
                    Map.of(
                        "name", "tags",
                        "selector", ".tag",
                        "type", "list",
                        "fields", List.of(Map.of("name", "tag", "type", "text")))));

    ExtractionSchema schema = SchemaParser.parse(json);

    assertThat(schema.name()).isEqualTo("Blog Posts");
    assertThat(schema.baseSelector()).isEqualTo("article");
    assertThat(schema.fields()).extracting(SchemaField::name).containsExactly("title", "link", "tags");
    assertThat(schema.fields().get(0).defaultValue()).isEqualTo("untitled");
    assertThat(schema.fields().get(1).kind()).isEqualTo(FieldKind.ATTRIBUTE);
    assertThat(schema.fields().get(1).attribute()).isEqualTo("href");
    SchemaField tags = schema.fields().get(2);
    assertThat(tags.kind()).isEqualTo(FieldKind.LIST);
    assertThat(tags.children()).containsExactly(SchemaField.text("tag", null));
  }

  @Test
  void missingBaseSelectorDefaultsToBody() {
    ExtractionSchema schema = SchemaParser.parse(Map.of("name", "x", "fields", List.of()));

    assertThat(schema.baseSelector()).isEqualTo("body");
    assertThat(schema.fields()).isEmpty();
  }

  @Test
  void unknownTypeDegradesToText() {
    ExtractionSchema schema =
        SchemaParser.parse(
            Map.of("fields", List.of(Map.of("name", "x", "selector", "p", "type", "regex"))));

    assertThat(schema.fields().get(0).kind()).isEqualTo(FieldKind.TEXT);
  }

  @Test
  void nestedListSpellingIsAcceptedAsList() {
    ExtractionSchema schema =
        SchemaParser.parse(
            Map.of("fields", List.of(Map.of("name", "rows", "selector", "tr", "type", "nested_list"))));

    assertThat(schema.fields().get(0).kind()).isEqualTo(FieldKind.LIST);
  }

  @Test
  void malformedFieldsAreSkipped() {
    ExtractionSchema schema =
        SchemaParser.parse(
            Map.of(
                "fields",
                List.of(
                    "not an object",
                    Map.of("selector", "h1"),
                    Map.of("name", "kept", "selector", "h2"))));

    assertThat(schema.fields()).extracting(SchemaField::name).containsExactly("kept");
  }

  @Test
  void fieldsThatAreNotAListAreIgnored() {
    ExtractionSchema schema = SchemaParser.parse(Map.of("fields", "oops"));

    assertThat(schema.fields()).isEmpty();
  }
}
