package dev.harvester.sink;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.harvester.crawl.CrawlResult;
import dev.harvester.fixture.CrawlResultBuilder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesResultSinkTest {

  private static final Instant TIMESTAMP = Instant.parse("2025-02-03T04:05:06Z");

  private final ObjectMapper objectMapper =
      JsonMapper.builder()
          .addModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  @TempDir Path tempDir;

  private JsonLinesResultSink sink;

  @BeforeEach
  void setUp() {
    sink = new JsonLinesResultSink(tempDir, objectMapper);
  }

  private static final Map<String, Object> FIRST_ITEM =
      Map.of(
          "title", "Release notes",
          "author", "Ada",
          "categories", List.of(Map.of("category", "News"), Map.of("category", "Tech")),
          "tags", List.of(Map.of("tag", "java"), Map.of("tag", "crawling")));

  private static CrawlResult blogPost(String url) {
    return new CrawlResultBuilder()
        .url(url)
        .title("Release notes")
        .rawMarkdown("# Release notes\n\nEverything that changed")
        .fitMarkdown("Everything that changed")
        .extractedItem(FIRST_ITEM)
        .extractedItem(Map.of("title", "Second item"))
        .internalLink("https://blog.example.com/older", "Older posts")
        .build();
  }

  @Test
  void resultLineUsesSnakeCaseLayout() throws Exception {
    sink.writeResult(ResultRecord.from(blogPost("https://blog.example.com/notes"), TIMESTAMP));

    List<String> lines = Files.readAllLines(sink.resultsFile(), StandardCharsets.UTF_8);
    assertThat(lines).hasSize(1);
    JsonNode line = objectMapper.readTree(lines.get(0));
    assertThat(line.get("url").asText()).isEqualTo("https://blog.example.com/notes");
    assertThat(line.get("timestamp").asText()).isEqualTo("2025-02-03T04:05:06Z");
    assertThat(line.at("/content/title").asText()).isEqualTo("Release notes");
    assertThat(line.at("/content/raw_markdown").asText()).startsWith("# Release notes");
    assertThat(line.at("/content/fit_markdown").asText()).isEqualTo("Everything that changed");
    assertThat(line.at("/metadata/word_count").asInt()).isEqualTo(6);
    assertThat(line.at("/metadata/fields/author").asText()).isEqualTo("Ada");
    assertThat(line.at("/metadata/fields/categories/1/category").asText()).isEqualTo("Tech");
    assertThat(line.at("/metadata/fields/tags/0/tag").asText()).isEqualTo("java");
    assertThat(line.at("/links/internal/0/href").asText())
        .isEqualTo("https://blog.example.com/older");
  }

  @Test
  void metadataFieldsComeFromFirstExtractedItemOnly() {
    ResultRecord record = ResultRecord.from(blogPost("https://blog.example.com/notes"), TIMESTAMP);

    assertThat(record.metadata().fields()).isEqualTo(FIRST_ITEM);
    assertThat(ResultRecord.from(new CrawlResultBuilder().build(), TIMESTAMP).metadata().fields())
        .isEmpty();
  }

  @Test
  void recordsAreAppendedAndReadBackInOrder() throws Exception {
    ResultRecord first = ResultRecord.from(blogPost("https://blog.example.com/1"), TIMESTAMP);
    ResultRecord second = ResultRecord.from(blogPost("https://blog.example.com/2"), TIMESTAMP);
    ErrorRecord error =
        new ErrorRecord("https://blog.example.com/3", TIMESTAMP, FailureKind.TIMEOUT, "timed out");

    assertThat(sink.writeResult(first)).isTrue();
    assertThat(sink.writeResult(second)).isTrue();
    assertThat(sink.writeError(error)).isTrue();

    assertThat(sink.readResults()).containsExactly(first, second);
    assertThat(sink.readErrors()).containsExactly(error);
  }

  @Test
  void nestedExtractedFieldsSurviveTheRoundTrip() throws Exception {
    sink.writeResult(ResultRecord.from(blogPost("https://blog.example.com/nested"), TIMESTAMP));

    ResultRecord readBack = sink.readResults().get(0);

    assertThat(readBack.metadata().fields()).isEqualTo(FIRST_ITEM);
    assertThat(readBack.metadata().fields().get("categories"))
        .asInstanceOf(InstanceOfAssertFactories.LIST)
        .containsExactly(Map.of("category", "News"), Map.of("category", "Tech"));
  }

  @Test
  void errorKindIsWrittenLowercase() throws Exception {
    sink.writeError(
        new ErrorRecord("https://blog.example.com/x", TIMESTAMP, FailureKind.FAILED, "HTTP 500"));

    String line = Files.readString(sink.errorsFile(), StandardCharsets.UTF_8);
    assertThat(line).contains("\"kind\":\"failed\"").endsWith("\n");
  }

  @Test
  void nothingWrittenMeansNothingToRead() throws Exception {
    assertThat(sink.readResults()).isEmpty();
    assertThat(sink.readErrors()).isEmpty();
  }

  @Test
  void failedWriteOnlyLosesItsOwnRecord() throws Exception {
    Files.createDirectory(sink.resultsFile());
    ErrorRecord error =
        new ErrorRecord("https://blog.example.com/3", TIMESTAMP, FailureKind.ERROR, "boom");

    boolean resultWritten =
        sink.writeResult(ResultRecord.from(blogPost("https://blog.example.com/1"), TIMESTAMP));
    boolean errorWritten = sink.writeError(error);

    assertThat(resultWritten).isFalse();
    assertThat(errorWritten).isTrue();
    assertThat(sink.readErrors()).containsExactly(error);
  }

  @Test
  void concurrentWritersNeverInterleaveLines() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    for (int i = 0; i < 200; i++) {
      String url = "https://blog.example.com/" + i;
      pool.execute(() -> sink.writeResult(ResultRecord.from(blogPost(url), TIMESTAMP)));
    }
    pool.shutdown();
    assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

    assertThat(sink.readResults()).hasSize(200);
  }
}
