package dev.harvester.sink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** Creates one timestamped output directory per bulk run under a common root. */
public class RunDirectories {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final Path outputRoot;
  private final Clock clock;

  public RunDirectories(Path outputRoot, Clock clock) {
    this.outputRoot = outputRoot;
    this.clock = clock;
  }

  /**
   * Creates {@code <root>/<yyyyMMdd_HHmmss>}. A second run within the same second gets a numeric
   * suffix instead of sharing the directory.
   *
   * @return the new, empty run directory
   * @throws IOException if the directory cannot be created
   */
  public Path create() throws IOException {
    Files.createDirectories(outputRoot);
    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    Path candidate = outputRoot.resolve(timestamp);
    int suffix = 1;
    while (Files.exists(candidate)) {
      candidate = outputRoot.resolve(timestamp + "_" + suffix++);
    }
    return Files.createDirectory(candidate);
  }
}
