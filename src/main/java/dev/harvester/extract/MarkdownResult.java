package dev.harvester.extract;

/**
 * Markdown rendering of one element tree.
 *
 * @param markdown markdown with inline {@code [text](url)} links
 * @param markdownWithCitations the same markdown with links replaced by {@code text⟨n⟩} markers
 * @param referencesMarkdown numbered reference list for the citation markers, empty without links
 */
public record MarkdownResult(
    String markdown, String markdownWithCitations, String referencesMarkdown) {}
