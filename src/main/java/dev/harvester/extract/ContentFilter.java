package dev.harvester.extract;

import org.jsoup.nodes.Element;

/**
 * Selects the main content of a cleaned page body. Implementations work on a copy and leave the
 * given element untouched.
 */
@FunctionalInterface
public interface ContentFilter {

  Element apply(Element body);

  /** Keeps everything: fit markdown equals raw markdown. */
  static ContentFilter none() {
    return Element::clone;
  }
}
