package dev.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Harvester crawl service.
 *
 * <p>Serves the crawl task API and, with {@code harvester.batch.enabled}, runs a bulk sitemap
 * crawl at startup.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class HarvesterApplication {
    public static void main(String[] args) {
        SpringApplication.run(HarvesterApplication.class, args);
    }
}
