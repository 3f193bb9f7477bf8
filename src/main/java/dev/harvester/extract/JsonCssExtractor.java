package dev.harvester.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates an {@link ExtractionSchema} against a parsed page. Produces one object per element
 * matching the base selector, in document order. Never throws: invalid selectors match nothing
 * and missing matches fall back to the field default.
 */
public class JsonCssExtractor {

  private static final Logger log = LoggerFactory.getLogger(JsonCssExtractor.class);

  public List<Map<String, Object>> extract(Element root, ExtractionSchema schema) {
    List<Map<String, Object>> items = new ArrayList<>();
    for (Element base : select(root, schema.baseSelector())) {
      items.add(extractFields(base, schema.fields()));
    }
    return items;
  }

  private Map<String, Object> extractFields(Element scope, List<SchemaField> fields) {
    Map<String, Object> item = new LinkedHashMap<>();
    for (SchemaField field : fields) {
      item.put(field.name(), extractField(scope, field));
    }
    return item;
  }

  private Object extractField(Element scope, SchemaField field) {
    if (field.kind() == FieldKind.LIST) {
      List<Element> matches = matches(scope, field.selector());
      if (matches.isEmpty()) {
        return defaultValue(field);
      }
      List<Object> values = new ArrayList<>(matches.size());
      for (Element match : matches) {
        values.add(
            field.children().isEmpty()
                ? match.text().trim()
                : extractFields(match, field.children()));
      }
      return values;
    }

    List<Element> matches = matches(scope, field.selector());
    if (matches.isEmpty()) {
      return defaultValue(field);
    }
    Element first = matches.get(0);
    return switch (field.kind()) {
      case HTML -> first.html();
      case ATTRIBUTE -> attributeValue(first, field);
      case NESTED -> extractFields(first, field.children());
      default -> first.text().trim();
    };
  }

  private Object attributeValue(Element element, SchemaField field) {
    String attribute = field.attribute();
    if (attribute == null || attribute.isBlank() || !element.hasAttr(attribute)) {
      return defaultValue(field);
    }
    return element.attr(attribute);
  }

  private List<Element> matches(Element scope, @Nullable String selector) {
    if (selector == null || selector.isBlank()) {
      return List.of(scope);
    }
    return select(scope, selector);
  }

  private Elements select(Element scope, String selector) {
    try {
      return scope.select(selector);
    } catch (Selector.SelectorParseException e) {
      log.warn("Invalid CSS selector '{}', treating it as no match: {}", selector, e.getMessage());
      return new Elements();
    }
  }

  private static Object defaultValue(SchemaField field) {
    if (field.defaultValue() != null) {
      return field.defaultValue();
    }
    return switch (field.kind()) {
      case LIST -> List.of();
      case NESTED -> Map.of();
      default -> "";
    };
  }
}
