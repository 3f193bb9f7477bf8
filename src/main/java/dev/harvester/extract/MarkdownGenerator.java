package dev.harvester.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Renders a jsoup element tree as markdown.
 *
 * <p>Block elements (headings, paragraphs, lists, fenced code, blockquotes, rules, pipe tables and
 * generic containers) become blank-line separated blocks; inline elements (emphasis, inline code,
 * links, images, line breaks) are rendered within their block. Links and images use absolute URLs
 * resolved against the element's base URI. Rendering is deterministic and never mutates the tree.
 *
 * <p>Elements nested more than {@value #MAX_NESTING_DEPTH} levels deep are flattened to their
 * plain text.
 */
public class MarkdownGenerator {

  private static final Set<String> HEADINGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");

  private static final Set<String> CONTAINERS =
      Set.of(
          "html", "body", "div", "section", "article", "main", "header", "footer", "nav", "aside",
          "figure", "figcaption", "form", "fieldset", "details", "summary", "address", "center",
          "li", "dl", "dt", "dd", "p", "caption", "tbody", "thead", "tfoot", "tr", "td", "th",
          "hgroup", "search");

  private static final Set<String> SPECIAL_BLOCKS =
      Set.of("ul", "ol", "pre", "blockquote", "hr", "table");

  static final int MAX_NESTING_DEPTH = 256;

  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0]+");
  private static final Pattern LINE_SPACES = Pattern.compile("[ \\t\\x0B\\f\\r\\u00a0]+");

  public MarkdownResult generate(Element root) {
    String markdown = new Renderer(false).render(root);
    Renderer citing = new Renderer(true);
    String withCitations = citing.render(root);
    return new MarkdownResult(markdown, withCitations, citing.referencesMarkdown());
  }

  static boolean isBlock(Element element) {
    String tag = element.normalName();
    return HEADINGS.contains(tag) || SPECIAL_BLOCKS.contains(tag) || CONTAINERS.contains(tag);
  }

  /** One rendering pass; holds the citation numbering of that pass. */
  private static final class Renderer {

    private final boolean citations;
    private final Map<String, Integer> citationNumbers = new LinkedHashMap<>();
    private final Map<String, String> citationTexts = new LinkedHashMap<>();
    private int depth;

    Renderer(boolean citations) {
      this.citations = citations;
    }

    String render(Element root) {
      return String.join("\n\n", blocks(root));
    }

    String referencesMarkdown() {
      if (citationNumbers.isEmpty()) {
        return "";
      }
      StringBuilder references = new StringBuilder("\n\n## References\n\n");
      citationNumbers.forEach(
          (url, number) -> {
            references.append('⟨').append(number).append("⟩ ").append(url);
            String text = citationTexts.get(url);
            if (text != null && !text.isEmpty()) {
              references.append(": ").append(text);
            }
            references.append('\n');
          });
      return references.toString();
    }

    private List<String> blocks(Element container) {
      if (depth >= MAX_NESTING_DEPTH) {
        return nonEmpty(singleLine(container.text()));
      }
      depth++;
      try {
        List<String> blocks = new ArrayList<>();
        StringBuilder inline = new StringBuilder();
        for (Node child : container.childNodes()) {
          if (child instanceof Element element && isBlock(element)) {
            flushParagraph(inline, blocks);
            blocks.addAll(block(element));
          } else {
            inline.append(inline(child));
          }
        }
        flushParagraph(inline, blocks);
        return blocks;
      } finally {
        depth--;
      }
    }

    private void flushParagraph(StringBuilder inline, List<String> blocks) {
      String paragraph = normalizeLines(inline.toString());
      if (!paragraph.isEmpty()) {
        blocks.add(paragraph);
      }
      inline.setLength(0);
    }

    private List<String> block(Element element) {
      String tag = element.normalName();
      if (HEADINGS.contains(tag)) {
        String text = singleLine(inlineChildren(element));
        if (text.isEmpty()) {
          return List.of();
        }
        int level = tag.charAt(1) - '0';
        return List.of("#".repeat(level) + " " + text);
      }
      return switch (tag) {
        case "ul", "ol" -> list(element, tag.equals("ol"));
        case "pre" -> codeBlock(element);
        case "blockquote" -> blockquote(element);
        case "hr" -> List.of("---");
        case "table" -> table(element);
        default -> blocks(element);
      };
    }

    private List<String> list(Element list, boolean ordered) {
      List<String> items = new ArrayList<>();
      int number = 1;
      for (Element child : list.children()) {
        List<String> itemBlocks = child.normalName().equals("li") || isBlock(child)
            ? blocks(child)
            : nonEmpty(normalizeLines(inline(child)));
        if (itemBlocks.isEmpty()) {
          continue;
        }
        String marker = ordered ? (number++) + "." : "-";
        String indent = " ".repeat(marker.length() + 1);
        String body = String.join("\n", itemBlocks);
        items.add(marker + " " + body.replace("\n", "\n" + indent));
      }
      return items.isEmpty() ? List.of() : List.of(String.join("\n", items));
    }

    private List<String> codeBlock(Element pre) {
      String code = pre.wholeText().replaceAll("\\n+$", "");
      if (code.isBlank()) {
        return List.of();
      }
      String language = "";
      Element codeElement = pre.selectFirst("code");
      if (codeElement != null) {
        for (String className : codeElement.classNames()) {
          if (className.startsWith("language-")) {
            language = className.substring("language-".length());
            break;
          }
        }
      }
      return List.of("```" + language + "\n" + code + "\n```");
    }

    private List<String> blockquote(Element quote) {
      List<String> inner = blocks(quote);
      if (inner.isEmpty()) {
        return List.of();
      }
      StringBuilder quoted = new StringBuilder();
      for (String line : String.join("\n\n", inner).split("\n", -1)) {
        if (quoted.length() > 0) {
          quoted.append('\n');
        }
        quoted.append(line.isEmpty() ? ">" : "> " + line);
      }
      return List.of(quoted.toString());
    }

    private List<String> table(Element table) {
      List<String> rows = new ArrayList<>();
      int columns = 0;
      for (Element row : table.select("tr")) {
        if (row.closest("table") != table) {
          continue;
        }
        List<String> cells = new ArrayList<>();
        for (Element cell : row.children()) {
          if (cell.normalName().equals("td") || cell.normalName().equals("th")) {
            cells.add(singleLine(inlineChildren(cell)).replace("|", "\\|"));
          }
        }
        if (!cells.isEmpty()) {
          rows.add("| " + String.join(" | ", cells) + " |");
          columns = Math.max(columns, cells.size());
        }
      }
      if (rows.isEmpty()) {
        return List.of();
      }
      rows.add(1, "|" + " --- |".repeat(columns));
      return List.of(String.join("\n", rows));
    }

    private String inline(Node node) {
      if (node instanceof TextNode text) {
        return WHITESPACE.matcher(text.getWholeText()).replaceAll(" ");
      }
      if (!(node instanceof Element element)) {
        return "";
      }
      return switch (element.normalName()) {
        case "br" -> "\n";
        case "strong", "b" -> wrap(inlineChildren(element), "**");
        case "em", "i" -> wrap(inlineChildren(element), "*");
        case "code", "kbd", "samp" -> inlineCode(element);
        case "a" -> link(element);
        case "img" -> image(element);
        default -> isBlock(element)
            ? " " + inlineChildren(element) + " "
            : inlineChildren(element);
      };
    }

    private String inlineChildren(Element element) {
      if (depth >= MAX_NESTING_DEPTH) {
        return element.text();
      }
      depth++;
      try {
        StringBuilder out = new StringBuilder();
        for (Node child : element.childNodes()) {
          out.append(inline(child));
        }
        return out.toString();
      } finally {
        depth--;
      }
    }

    private String inlineCode(Element element) {
      String code = WHITESPACE.matcher(element.wholeText()).replaceAll(" ").trim();
      return code.isEmpty() ? "" : "`" + code + "`";
    }

    private String link(Element anchor) {
      String text = singleLine(inlineChildren(anchor));
      String href = resolve(anchor, "href");
      if (href.isEmpty() || text.isEmpty()) {
        return text;
      }
      if (citations) {
        Integer number = citationNumbers.get(href);
        if (number == null) {
          number = citationNumbers.size() + 1;
          citationNumbers.put(href, number);
          citationTexts.put(href, text);
        }
        return text + "⟨" + number + "⟩";
      }
      return "[" + text + "](" + href + ")";
    }

    private String image(Element image) {
      String src = resolve(image, "src");
      if (src.isEmpty()) {
        return "";
      }
      String alt = WHITESPACE.matcher(image.attr("alt")).replaceAll(" ").trim();
      return "![" + alt + "](" + src + ")";
    }
  }

  private static String resolve(Element element, String attribute) {
    String absolute = element.absUrl(attribute);
    return absolute.isEmpty() ? element.attr(attribute).trim() : absolute;
  }

  private static String wrap(String content, String marker) {
    String trimmed = content.trim();
    if (trimmed.isEmpty()) {
      return content;
    }
    String leading = Character.isWhitespace(content.charAt(0)) ? " " : "";
    String trailing = Character.isWhitespace(content.charAt(content.length() - 1)) ? " " : "";
    return leading + marker + trimmed + marker + trailing;
  }

  private static String singleLine(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  private static String normalizeLines(String text) {
    List<String> lines = new ArrayList<>();
    for (String line : text.split("\n")) {
      String normalized = LINE_SPACES.matcher(line).replaceAll(" ").trim();
      if (!normalized.isEmpty()) {
        lines.add(normalized);
      }
    }
    return String.join("\n", lines);
  }

  private static List<String> nonEmpty(String text) {
    return text.isEmpty() ? List.of() : List.of(text);
  }
}
