package dev.harvester.extract;

import java.util.List;

/**
 * CSS-selector driven extraction schema: one object is extracted per element matching {@code
 * baseSelector}, with one entry per field.
 */
public record ExtractionSchema(String name, String baseSelector, List<SchemaField> fields) {

  public ExtractionSchema {
    name = name == null ? "" : name;
    baseSelector = baseSelector == null || baseSelector.isBlank() ? "body" : baseSelector;
    fields = fields == null ? List.of() : List.copyOf(fields);
  }
}
