package dev.harvester.render;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "harvester.crawl4ai")
public record Crawl4AiProperties(
        @DefaultValue("http://localhost:11235") String baseUrl,
        @DefaultValue("5000") int connectTimeoutMs,
        @DefaultValue("60000") int readTimeoutMs,
        @DefaultValue("enabled") String cacheMode,
        @DefaultValue({"--disable-gpu", "--no-sandbox", "--disable-dev-shm-usage"})
                List<String> browserArgs,
        @DefaultValue("1920") int viewportWidth,
        @DefaultValue("1080") int viewportHeight
) {
    public Crawl4AiProperties {
        browserArgs = browserArgs == null ? List.of() : List.copyOf(browserArgs);
    }
}
