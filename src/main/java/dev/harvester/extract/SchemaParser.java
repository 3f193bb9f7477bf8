package dev.harvester.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an {@link ExtractionSchema} from its JSON object form, as sent in a crawl request's
 * {@code custom_schema}:
 *
 * <pre>{@code
 * {"name": "...", "baseSelector": "article",
 *  "fields": [{"name": "title", "selector": "h1", "type": "text", "default": ""},
 *             {"name": "tags", "selector": ".tag", "type": "list",
 *              "fields": [{"name": "tag", "type": "text"}]}]}
 * }</pre>
 *
 * <p>Malformed parts never fail the crawl: fields without a name are skipped and unknown types
 * fall back to text, each with a warning.
 */
public final class SchemaParser {

  private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

  private SchemaParser() {
    // utility class
  }

  public static ExtractionSchema parse(Map<String, ?> json) {
    String name = stringValue(json.get("name"));
    String baseSelector = stringValue(json.get("baseSelector"));
    if (baseSelector == null) {
      baseSelector = stringValue(json.get("base_selector"));
    }
    return new ExtractionSchema(name, baseSelector, parseFields(json.get("fields")));
  }

  private static List<SchemaField> parseFields(@Nullable Object rawFields) {
    if (rawFields == null) {
      return List.of();
    }
    if (!(rawFields instanceof List<?> list)) {
      log.warn("Ignoring schema fields that are not a list: {}", rawFields);
      return List.of();
    }
    List<SchemaField> fields = new ArrayList<>();
    for (Object rawField : list) {
      if (!(rawField instanceof Map<?, ?> fieldJson)) {
        log.warn("Ignoring schema field that is not an object: {}", rawField);
        continue;
      }
      SchemaField field = parseField(fieldJson);
      if (field != null) {
        fields.add(field);
      }
    }
    return fields;
  }

  private static @Nullable SchemaField parseField(Map<?, ?> json) {
    String name = stringValue(json.get("name"));
    if (name == null || name.isBlank()) {
      log.warn("Ignoring schema field without a name: {}", json);
      return null;
    }
    String typeName = stringValue(json.get("type"));
    FieldKind kind = FieldKind.fromTypeName(typeName == null ? "text" : typeName);
    if (kind == null) {
      log.warn("Unknown type '{}' for schema field '{}', extracting it as text", typeName, name);
      kind = FieldKind.TEXT;
    }
    return new SchemaField(
        name,
        stringValue(json.get("selector")),
        kind,
        stringValue(json.get("attribute")),
        json.get("default"),
        parseFields(json.get("fields")));
  }

  private static @Nullable String stringValue(@Nullable Object value) {
    return value == null ? null : value.toString();
  }
}
