package dev.harvester.sink;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunDirectoriesTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-06-07T08:09:10Z"), ZoneOffset.UTC);

  @TempDir Path tempDir;

  @Test
  void createsTimestampedDirectoryUnderRoot() throws Exception {
    Path root = tempDir.resolve("output");

    Path runDir = new RunDirectories(root, CLOCK).create();

    assertThat(runDir).isEqualTo(root.resolve("20250607_080910"));
    assertThat(Files.isDirectory(runDir)).isTrue();
  }

  @Test
  void runsInTheSameSecondGetDistinctDirectories() throws Exception {
    RunDirectories directories = new RunDirectories(tempDir, CLOCK);

    Path first = directories.create();
    Path second = directories.create();
    Path third = directories.create();

    assertThat(first.getFileName()).hasToString("20250607_080910");
    assertThat(second.getFileName()).hasToString("20250607_080910_1");
    assertThat(third.getFileName()).hasToString("20250607_080910_2");
  }
}
