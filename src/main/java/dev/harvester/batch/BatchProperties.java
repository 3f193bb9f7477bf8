package dev.harvester.batch;

import dev.harvester.render.WaitCondition;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for bulk sitemap crawls, bound from {@code harvester.batch.*}.
 *
 * @param enabled run a bulk crawl of {@code baseUrl} at startup
 * @param baseUrl site whose sitemaps seed the bulk crawl
 * @param maxConcurrent batch size, i.e. pages rendered at once
 * @param batchDelay cool-down between two batches
 * @param outputRoot directory under which each run gets its own timestamped directory
 * @param pageTimeoutMs page timeout handed to the renderer
 * @param filterThreshold pruning filter threshold for the fit markdown
 * @param waitFor load condition to wait for
 * @param schemaLocation Spring resource location of the extraction schema, blank for none
 * @param exitOnCompletion close the application once the bulk run is done
 */
@ConfigurationProperties(prefix = "harvester.batch")
public record BatchProperties(
    @DefaultValue("false") boolean enabled,
    @Nullable String baseUrl,
    @DefaultValue("5") int maxConcurrent,
    @DefaultValue("1s") Duration batchDelay,
    @DefaultValue("output") String outputRoot,
    @DefaultValue("30000") int pageTimeoutMs,
    @DefaultValue("0.45") double filterThreshold,
    @DefaultValue("domcontentloaded") WaitCondition waitFor,
    @DefaultValue("classpath:schemas/blog-posts.json") String schemaLocation,
    @DefaultValue("false") boolean exitOnCompletion) {

  public BatchProperties {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException(
          "harvester.batch.max-concurrent must be >= 1, got: " + maxConcurrent);
    }
    if (batchDelay == null || batchDelay.isNegative()) {
      batchDelay = Duration.ZERO;
    }
  }
}
