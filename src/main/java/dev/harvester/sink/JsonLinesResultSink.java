package dev.harvester.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes results and errors as JSON lines into a run directory.
 *
 * <p>Produces two files: {@code results.jsonl} with one {@link ResultRecord} per line and {@code
 * errors.jsonl} with one {@link ErrorRecord} per line. Each record is appended with its own open,
 * so earlier lines survive a crash and a failed write only loses its own record.
 */
public class JsonLinesResultSink implements ResultSink {

  private static final Logger log = LoggerFactory.getLogger(JsonLinesResultSink.class);

  public static final String RESULTS_FILE = "results.jsonl";
  public static final String ERRORS_FILE = "errors.jsonl";

  private final Path resultsFile;
  private final Path errorsFile;
  private final ObjectMapper objectMapper;
  private final ObjectWriter lineWriter;

  public JsonLinesResultSink(Path directory, ObjectMapper objectMapper) {
    this.resultsFile = directory.resolve(RESULTS_FILE);
    this.errorsFile = directory.resolve(ERRORS_FILE);
    this.objectMapper = objectMapper;
    this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
  }

  @Override
  public boolean writeResult(ResultRecord record) {
    return append(resultsFile, record, record.url());
  }

  @Override
  public boolean writeError(ErrorRecord record) {
    return append(errorsFile, record, record.url());
  }

  /**
   * Re-reads every result written so far.
   *
   * @return the records in write order, empty if nothing was written
   * @throws IOException if the file cannot be read or a line cannot be parsed
   */
  public List<ResultRecord> readResults() throws IOException {
    return read(resultsFile, ResultRecord.class);
  }

  /**
   * Re-reads every error written so far.
   *
   * @return the records in write order, empty if nothing was written
   * @throws IOException if the file cannot be read or a line cannot be parsed
   */
  public List<ErrorRecord> readErrors() throws IOException {
    return read(errorsFile, ErrorRecord.class);
  }

  public Path resultsFile() {
    return resultsFile;
  }

  public Path errorsFile() {
    return errorsFile;
  }

  private synchronized boolean append(Path file, Object record, String url) {
    try {
      String line = lineWriter.writeValueAsString(record) + "\n";
      Files.writeString(
          file,
          line,
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.WRITE,
          StandardOpenOption.APPEND);
      return true;
    } catch (IOException e) {
      log.error("Failed to write record for {} to {}: {}", url, file, e.getMessage());
      return false;
    }
  }

  private <T> List<T> read(Path file, Class<T> type) throws IOException {
    if (!Files.exists(file)) {
      return List.of();
    }
    List<T> records = new ArrayList<>();
    for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
      if (!line.isBlank()) {
        records.add(objectMapper.readValue(line, type));
      }
    }
    return records;
  }
}
