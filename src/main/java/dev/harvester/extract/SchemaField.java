package dev.harvester.extract;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One field of an {@link ExtractionSchema}.
 *
 * @param name key of the field in the extracted object
 * @param selector CSS selector relative to the enclosing element, or null to read that element itself
 * @param kind how matches are turned into a value
 * @param attribute attribute name, only used by {@link FieldKind#ATTRIBUTE}
 * @param defaultValue value used when the selector matches nothing
 * @param children child fields, only used by {@link FieldKind#NESTED} and {@link FieldKind#LIST}
 */
public record SchemaField(
    String name,
    @Nullable String selector,
    FieldKind kind,
    @Nullable String attribute,
    @Nullable Object defaultValue,
    List<SchemaField> children) {

  public SchemaField {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Schema field name must not be blank");
    }
    kind = kind == null ? FieldKind.TEXT : kind;
    children = children == null ? List.of() : List.copyOf(children);
  }

  public static SchemaField text(String name, @Nullable String selector) {
    return new SchemaField(name, selector, FieldKind.TEXT, null, null, List.of());
  }

  public static SchemaField html(String name, @Nullable String selector) {
    return new SchemaField(name, selector, FieldKind.HTML, null, null, List.of());
  }

  public static SchemaField attribute(String name, @Nullable String selector, String attribute) {
    return new SchemaField(name, selector, FieldKind.ATTRIBUTE, attribute, null, List.of());
  }

  public static SchemaField list(String name, String selector, List<SchemaField> children) {
    return new SchemaField(name, selector, FieldKind.LIST, null, null, children);
  }

  public static SchemaField nested(String name, String selector, List<SchemaField> children) {
    return new SchemaField(name, selector, FieldKind.NESTED, null, null, children);
  }
}
