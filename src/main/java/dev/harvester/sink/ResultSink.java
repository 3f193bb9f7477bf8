package dev.harvester.sink;

/**
 * Append-only destination for bulk crawl outcomes. A write that fails is reported as {@code false}
 * and never affects other writes.
 */
public interface ResultSink {

  boolean writeResult(ResultRecord record);

  boolean writeError(ErrorRecord record);
}
