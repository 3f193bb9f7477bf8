package dev.harvester.extract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Content filter applied when producing fit markdown. */
public enum FilterType {
  PRUNING,
  BM25,
  NONE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static FilterType fromWireName(String value) {
    for (FilterType type : values()) {
      if (type.wireName().equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown content filter: " + value);
  }
}
