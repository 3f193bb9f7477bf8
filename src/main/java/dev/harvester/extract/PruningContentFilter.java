package dev.harvester.extract;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Removes boilerplate by scoring every block element top-down and dropping those whose composite
 * score falls below a per-node threshold.
 *
 * <p>The score weighs text density (text length over markup length), link density, a per-tag
 * weight, a penalty for boilerplate-looking class and id names, and the logarithm of the text
 * length. The threshold is lowered for important tags and text-dense nodes and raised for
 * link-heavy nodes. Blocks with fewer than {@code minWords} words always score below it. Only
 * removals happen, so the filtered tree never holds more words than the input.
 */
public final class PruningContentFilter implements ContentFilter {

  private static final String STRUCTURAL_TAGS =
      "nav, header, footer, aside, form, button, input, select, textarea, menu, dialog";

  private static final Map<String, Double> TAG_WEIGHTS =
      Map.ofEntries(
          Map.entry("div", 0.5),
          Map.entry("p", 1.0),
          Map.entry("article", 1.5),
          Map.entry("section", 1.0),
          Map.entry("span", 0.3),
          Map.entry("li", 0.5),
          Map.entry("ul", 0.5),
          Map.entry("ol", 0.5),
          Map.entry("h1", 1.2),
          Map.entry("h2", 1.1),
          Map.entry("h3", 1.0),
          Map.entry("h4", 0.9),
          Map.entry("h5", 0.8),
          Map.entry("h6", 0.7));

  private static final Map<String, Double> TAG_IMPORTANCE =
      Map.ofEntries(
          Map.entry("article", 1.5),
          Map.entry("main", 1.4),
          Map.entry("section", 1.3),
          Map.entry("p", 1.2),
          Map.entry("h1", 1.4),
          Map.entry("h2", 1.3),
          Map.entry("h3", 1.2),
          Map.entry("div", 0.7),
          Map.entry("span", 0.6));

  private static final Pattern NEGATIVE_NAMES =
      Pattern.compile(
          "nav|footer|header|sidebar|ads|comment|promo|advert|social|share",
          Pattern.CASE_INSENSITIVE);

  private static final double TEXT_DENSITY_WEIGHT = 0.4;
  private static final double LINK_DENSITY_WEIGHT = 0.2;
  private static final double TAG_WEIGHT = 0.2;
  private static final double CLASS_ID_WEIGHT = 0.1;
  private static final double TEXT_LENGTH_WEIGHT = 0.1;

  private final double threshold;
  private final int minWords;

  public PruningContentFilter(double threshold, int minWords) {
    this.threshold = threshold;
    this.minWords = minWords;
  }

  @Override
  public Element apply(Element body) {
    Element copy = body.clone();
    copy.select(STRUCTURAL_TAGS).remove();
    // Parents are always decided before their children; nesting depth is unbounded.
    Deque<Element> pending = new ArrayDeque<>(copy.children());
    while (!pending.isEmpty()) {
      Element element = pending.pop();
      if (MarkdownGenerator.isBlock(element) && score(element) < thresholdFor(element)) {
        element.remove();
        continue;
      }
      for (Element child : element.children()) {
        pending.push(child);
      }
    }
    return copy;
  }

  double score(Element element) {
    String text = element.text();
    if (minWords > 0 && WordCounter.count(text) < minWords) {
      return -1.0;
    }
    int textLength = text.length();
    int tagLength = element.html().length();
    int linkTextLength = linkTextLength(element);

    double textDensity = tagLength > 0 ? (double) textLength / tagLength : 0.0;
    double linkDensity = 1.0 - (textLength > 0 ? (double) linkTextLength / textLength : 0.0);
    double tagWeight = TAG_WEIGHTS.getOrDefault(element.normalName(), 0.5);
    double classIdWeight = 0.0;
    if (NEGATIVE_NAMES.matcher(element.className()).find()) {
      classIdWeight -= 0.5;
    }
    if (NEGATIVE_NAMES.matcher(element.id()).find()) {
      classIdWeight -= 0.5;
    }
    double lengthScore = Math.log(textLength + 1.0);

    return TEXT_DENSITY_WEIGHT * textDensity
        + LINK_DENSITY_WEIGHT * linkDensity
        + TAG_WEIGHT * tagWeight
        + CLASS_ID_WEIGHT * classIdWeight
        + TEXT_LENGTH_WEIGHT * lengthScore;
  }

  double thresholdFor(Element element) {
    double nodeThreshold = threshold;
    if (TAG_IMPORTANCE.getOrDefault(element.normalName(), 0.7) > 1.0) {
      nodeThreshold *= 0.8;
    }
    int textLength = element.text().length();
    int tagLength = element.html().length();
    double textRatio = tagLength > 0 ? (double) textLength / tagLength : 0.0;
    double linkRatio = textLength > 0 ? (double) linkTextLength(element) / textLength : 0.0;
    if (textRatio > 0.4) {
      nodeThreshold *= 0.9;
    }
    if (linkRatio > 0.6) {
      nodeThreshold *= 1.2;
    }
    return nodeThreshold;
  }

  private static int linkTextLength(Element element) {
    int length = 0;
    for (Element child : element.children()) {
      if (child.normalName().equals("a")) {
        length += child.text().length();
      }
    }
    return length;
  }
}
