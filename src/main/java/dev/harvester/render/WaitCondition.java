package dev.harvester.render;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Browser load condition a render waits for before capturing the page. */
public enum WaitCondition {
  DOMCONTENTLOADED("domcontentloaded"),
  LOAD("load"),
  /** Rewritten to {@link #DOMCONTENTLOADED} before rendering; it stalls on long-polling pages. */
  NETWORKIDLE0("networkidle0"),
  NETWORKIDLE2("networkidle2");

  private final String wireName;

  WaitCondition(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** The condition actually sent to the browser. */
  public WaitCondition effective() {
    return this == NETWORKIDLE0 ? DOMCONTENTLOADED : this;
  }

  @JsonCreator
  public static WaitCondition fromWireName(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    for (WaitCondition condition : values()) {
      if (condition.wireName.equals(normalized)) {
        return condition;
      }
    }
    throw new IllegalArgumentException("Unknown wait condition: " + value);
  }
}
