package dev.harvester.crawl;

/**
 * Timing and size of one crawl.
 *
 * @param crawlTimeMs wall time spent rendering and extracting
 * @param pageSizeBytes UTF-8 size of the rendered HTML
 */
public record CrawlStats(long crawlTimeMs, long pageSizeBytes) {}
