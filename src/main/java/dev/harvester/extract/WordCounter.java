package dev.harvester.extract;

import java.util.regex.Pattern;

/** Counts whitespace-delimited tokens. */
public final class WordCounter {

  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private WordCounter() {
    // utility class
  }

  public static int count(String text) {
    if (text == null) {
      return 0;
    }
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }
}
