package dev.harvester.sink;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Why a bulk crawl item produced no result. */
public enum FailureKind {
  /** The renderer reported that it could not load the page. */
  FAILED,
  /** The render ran past its timeout. */
  TIMEOUT,
  /** Any other exception, including failures while building the result record. */
  ERROR;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static FailureKind fromWireName(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
