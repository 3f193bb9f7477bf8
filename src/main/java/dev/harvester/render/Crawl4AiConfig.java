package dev.harvester.render;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the Crawl4AI rendering sidecar.
 *
 * <p>The read timeout must stay above the largest page timeout a request may ask for, otherwise
 * slow renders surface as transport timeouts instead of browser errors.
 */
@Configuration
public class Crawl4AiConfig {

    /**
     * Creates the REST client targeting the sidecar.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties sidecar address and timeouts
     * @return a named REST client bean for injection into {@link Crawl4AiRenderer}
     */
    @Bean
    public RestClient crawl4AiRestClient(RestClient.Builder builder, Crawl4AiProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
