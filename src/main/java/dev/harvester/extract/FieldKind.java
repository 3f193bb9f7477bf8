package dev.harvester.extract;

import java.util.Locale;

/** How a {@link SchemaField} turns matched elements into a value. */
public enum FieldKind {
  /** Trimmed text content of the first match. */
  TEXT,
  /** Inner HTML of the first match. */
  HTML,
  /** Value of the field's attribute on the first match. */
  ATTRIBUTE,
  /** One object built from the child fields, evaluated against the first match. */
  NESTED,
  /** One object per match, built from the child fields evaluated against that match. */
  LIST;

  /**
   * Resolves a schema type name. Crawl4AI's {@code nested_list} spelling is accepted for {@link
   * #LIST}; unknown names are reported as null so the caller can decide on a fallback.
   */
  static FieldKind fromTypeName(String typeName) {
    if (typeName == null) {
      return null;
    }
    return switch (typeName.trim().toLowerCase(Locale.ROOT)) {
      case "text" -> TEXT;
      case "html" -> HTML;
      case "attribute" -> ATTRIBUTE;
      case "nested" -> NESTED;
      case "list", "nested_list", "nested-list" -> LIST;
      default -> null;
    };
  }
}
