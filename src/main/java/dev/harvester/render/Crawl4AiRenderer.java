package dev.harvester.render;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * {@link PageRenderer} backed by the Crawl4AI sidecar's headless Chromium.
 *
 * <p>Only the rendered DOM, link lists and media lists are taken from the sidecar; markdown
 * generation and filtering happen in-process so that they stay reproducible.
 */
@Service
public class Crawl4AiRenderer implements PageRenderer {

    private static final Logger log = LoggerFactory.getLogger(Crawl4AiRenderer.class);

    private final RestClient restClient;
    private final Crawl4AiProperties properties;

    public Crawl4AiRenderer(@Qualifier("crawl4AiRestClient") RestClient restClient,
                            Crawl4AiProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public RenderedPage render(String url, RenderOptions options) {
        Crawl4AiRequest request = buildRequest(url, options);
        log.debug("Rendering {} (wait: {}, timeout: {}ms, session: {})",
                url, options.waitUntil().wireName(), options.pageTimeoutMs(), options.sessionId());

        Crawl4AiResponse response;
        try {
            response = restClient.post()
                    .uri("/crawl")
                    .body(request)
                    .retrieve()
                    .body(Crawl4AiResponse.class);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new RenderTimeoutException(
                        "Render timeout for " + url + " after " + options.pageTimeoutMs() + "ms page timeout", e);
            }
            throw e;
        }

        Crawl4AiPageResult page = response == null ? null : response.pageResult().orElse(null);
        if (page == null) {
            return RenderedPage.failed(url, "Crawl4AI returned no results for " + url);
        }
        if (!page.success()) {
            return RenderedPage.failed(url, page.errorMessage());
        }

        return new RenderedPage(
                url,
                true,
                page.bestHtml(),
                new PageLinks(page.linksOfKind("internal"), page.linksOfKind("external")),
                page.images(),
                page.statusCode(),
                null);
    }

    Crawl4AiRequest buildRequest(String url, RenderOptions options) {
        Map<String, Object> crawlerParams = new LinkedHashMap<>();
        crawlerParams.put("cache_mode", properties.cacheMode());
        crawlerParams.put("page_timeout", options.pageTimeoutMs());
        crawlerParams.put("wait_until", options.waitUntil().effective().wireName());
        crawlerParams.put("wait_for_images", true);
        if (options.sessionId() != null) {
            crawlerParams.put("session_id", options.sessionId());
        }

        Map<String, Object> browserParams = Map.of(
                "headless", true,
                "extra_args", properties.browserArgs(),
                "viewport_width", properties.viewportWidth(),
                "viewport_height", properties.viewportHeight());
        return Crawl4AiRequest.forUrl(url, browserParams, crawlerParams);
    }
}
