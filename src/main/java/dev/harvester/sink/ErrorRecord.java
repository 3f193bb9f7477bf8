package dev.harvester.sink;

import java.time.Instant;

/** One line of {@code errors.jsonl}. */
public record ErrorRecord(String url, Instant timestamp, FailureKind kind, String error) {}
