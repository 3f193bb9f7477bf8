package dev.harvester.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Keeps the text blocks relevant to a query, ranked with Okapi BM25 over the page's own blocks.
 *
 * <p>Candidate blocks are the outermost paragraph-like elements (paragraphs, headings, list items,
 * quotes, code, table cells, definition terms, captions). Headings get a score boost. Blocks
 * scoring at least the threshold are copied, in document order, into a fresh {@code div}.
 */
public final class Bm25ContentFilter implements ContentFilter {

  private static final Set<String> CANDIDATE_TAGS =
      Set.of(
          "p", "h1", "h2", "h3", "h4", "h5", "h6", "li", "blockquote", "pre", "td", "th", "dt",
          "dd", "figcaption");

  private static final Map<String, Double> TAG_BOOST =
      Map.of("h1", 5.0, "h2", 4.0, "h3", 3.0, "h4", 2.5, "h5", 2.0, "h6", 1.5);

  private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

  private static final double K1 = 1.2;
  private static final double B = 0.75;

  private final List<String> queryTerms;
  private final double threshold;

  public Bm25ContentFilter(String query, double threshold) {
    this.queryTerms = tokenize(query);
    this.threshold = threshold;
  }

  @Override
  public Element apply(Element body) {
    List<Element> candidates = candidateBlocks(body);
    List<List<String>> documents = new ArrayList<>(candidates.size());
    for (Element candidate : candidates) {
      documents.add(tokenize(candidate.text()));
    }
    double[] scores = score(documents);

    Element kept = new Element("div");
    kept.setBaseUri(body.baseUri());
    for (int i = 0; i < candidates.size(); i++) {
      Element candidate = candidates.get(i);
      double boosted = scores[i] * TAG_BOOST.getOrDefault(candidate.normalName(), 1.0);
      if (boosted >= threshold) {
        kept.appendChild(candidate.clone());
      }
    }
    return kept;
  }

  double[] score(List<List<String>> documents) {
    int documentCount = documents.size();
    double[] scores = new double[documentCount];
    if (documentCount == 0 || queryTerms.isEmpty()) {
      return scores;
    }
    double averageLength =
        documents.stream().mapToInt(List::size).average().orElse(0.0);
    Map<String, Integer> documentFrequency = new HashMap<>();
    for (List<String> document : documents) {
      for (String term : new HashSet<>(document)) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }
    for (int i = 0; i < documentCount; i++) {
      List<String> document = documents.get(i);
      Map<String, Integer> termFrequency = new HashMap<>();
      for (String term : document) {
        termFrequency.merge(term, 1, Integer::sum);
      }
      double lengthNorm = averageLength > 0 ? document.size() / averageLength : 0.0;
      double score = 0.0;
      for (String term : queryTerms) {
        int tf = termFrequency.getOrDefault(term, 0);
        if (tf == 0) {
          continue;
        }
        int df = documentFrequency.getOrDefault(term, 0);
        double idf = Math.log(1.0 + (documentCount - df + 0.5) / (df + 0.5));
        score += idf * (tf * (K1 + 1)) / (tf + K1 * (1 - B + B * lengthNorm));
      }
      scores[i] = score;
    }
    return scores;
  }

  private static List<Element> candidateBlocks(Element root) {
    List<Element> candidates = new ArrayList<>();
    for (Element element : root.getAllElements()) {
      if (element == root || !CANDIDATE_TAGS.contains(element.normalName())) {
        continue;
      }
      if (element.text().isBlank() || hasCandidateAncestor(element, root)) {
        continue;
      }
      candidates.add(element);
    }
    return candidates;
  }

  private static boolean hasCandidateAncestor(Element element, Element root) {
    for (Element parent = element.parent(); parent != null && parent != root;
        parent = parent.parent()) {
      if (CANDIDATE_TAGS.contains(parent.normalName())) {
        return true;
      }
    }
    return false;
  }

  static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT)))
        .filter(token -> !token.isEmpty())
        .toList();
  }
}
