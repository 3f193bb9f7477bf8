package dev.harvester.batch;

import dev.harvester.sink.FailureKind;
import org.jspecify.annotations.Nullable;

/**
 * Outcome counters of one bulk run, accumulated across its batches.
 *
 * @param success items persisted as results
 * @param failed items the renderer could not load
 * @param timeout items whose render timed out
 * @param error items that failed with any other exception
 * @param batches number of batches run
 */
public record BatchStats(int success, int failed, int timeout, int error, int batches) {

  public static BatchStats empty() {
    return new BatchStats(0, 0, 0, 0, 0);
  }

  /** Counts one item; a null failure kind is a success. */
  BatchStats record(@Nullable FailureKind failure) {
    if (failure == null) {
      return new BatchStats(success + 1, failed, timeout, error, batches);
    }
    return switch (failure) {
      case FAILED -> new BatchStats(success, failed + 1, timeout, error, batches);
      case TIMEOUT -> new BatchStats(success, failed, timeout + 1, error, batches);
      case ERROR -> new BatchStats(success, failed, timeout, error + 1, batches);
    };
  }

  BatchStats nextBatch() {
    return new BatchStats(success, failed, timeout, error, batches + 1);
  }

  public int total() {
    return success + failed + timeout + error;
  }
}
