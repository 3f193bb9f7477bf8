package dev.harvester.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.harvester.crawl.CrawlOptions;
import dev.harvester.extract.ContentFilterPolicy;
import dev.harvester.extract.ExtractionSchema;
import dev.harvester.extract.SchemaParser;
import dev.harvester.sink.RunDirectories;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/** Beans for bulk crawls: default crawl options and the run-directory factory. */
@Configuration
public class BatchConfig {

  private static final Logger log = LoggerFactory.getLogger(BatchConfig.class);

  @Bean
  public CrawlOptions batchCrawlOptions(
      BatchProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    ExtractionSchema schema = loadSchema(properties.schemaLocation(), resourceLoader, objectMapper);
    return new CrawlOptions(
        ContentFilterPolicy.pruning(properties.filterThreshold()),
        schema,
        properties.waitFor(),
        properties.pageTimeoutMs());
  }

  @Bean
  public RunDirectories runDirectories(BatchProperties properties, Clock clock) {
    return new RunDirectories(Path.of(properties.outputRoot()), clock);
  }

  static @Nullable ExtractionSchema loadSchema(
      String location, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    if (location == null || location.isBlank()) {
      return null;
    }
    Resource resource = resourceLoader.getResource(location);
    try (InputStream in = resource.getInputStream()) {
      Map<String, Object> json = objectMapper.readValue(in, new TypeReference<>() {});
      ExtractionSchema schema = SchemaParser.parse(json);
      log.info("Loaded extraction schema '{}' from {}", schema.name(), location);
      return schema;
    } catch (IOException e) {
      throw new IllegalStateException("Cannot load extraction schema from " + location, e);
    }
  }
}
