package dev.harvester.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** A media element (image, video, audio) reported by the Crawl4AI sidecar. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiMedia(@Nullable String src, @Nullable String alt) {}
