package dev.harvester.extract;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Content extraction tuning.
 *
 * @param pruningMinWords blocks with fewer words are always removed by the pruning filter
 */
@ConfigurationProperties(prefix = "harvester.extraction")
public record ExtractionProperties(@DefaultValue("50") int pruningMinWords) {

  public ExtractionProperties {
    if (pruningMinWords < 0) {
      throw new IllegalArgumentException(
          "harvester.extraction.pruning-min-words must be >= 0, got: " + pruningMinWords);
    }
  }

  public static ExtractionProperties defaults() {
    return new ExtractionProperties(50);
  }
}
