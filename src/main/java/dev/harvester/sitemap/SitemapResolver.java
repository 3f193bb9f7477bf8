package dev.harvester.sitemap;

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;

/**
 * Discovers page URLs from a site's sitemap hierarchy using crawler-commons.
 *
 * <p>Conventional sitemap locations are tried in order and the first one that yields any URL
 * wins. A sitemap in which at least one location ends in {@code .xml} is read as a sitemap index
 * and its {@code .xml} entries are followed; see {@link SitemapProperties.IndexPolicy} for what
 * happens to the other entries.
 */
@Component
public class SitemapResolver {

    private static final Logger log = LoggerFactory.getLogger(SitemapResolver.class);

    private final RestClient httpClient;
    private final SitemapProperties properties;

    public SitemapResolver(RestClient.Builder restClientBuilder, SitemapProperties properties) {
        this.httpClient = restClientBuilder
                .defaultHeader(HttpHeaders.ACCEPT, "application/xml,text/xml;q=0.9,*/*;q=0.1")
                .build();
        this.properties = properties;
    }

    /**
     * Discover page URLs for a site.
     *
     * @param baseUrl any URL of the site; candidate paths are resolved against its root
     * @return deduplicated page URLs, empty if no candidate produced any
     */
    public Set<String> discover(String baseUrl) {
        for (URI candidate : candidates(baseUrl)) {
            Set<String> urls = tryCandidate(candidate);
            if (!urls.isEmpty()) {
                log.info("Found {} URLs in {}", urls.size(), candidate);
                return urls;
            }
        }
        log.info("No sitemap URLs found for {}", baseUrl);
        return Set.of();
    }

    List<URI> candidates(String baseUrl) {
        URI base = URI.create(baseUrl.trim());
        return properties.candidatePaths().stream()
                .map(base::resolve)
                .toList();
    }

    private Set<String> tryCandidate(URI sitemapUri) {
        try {
            byte[] content = fetchSitemap(sitemapUri);
            if (content == null) {
                return Set.of();
            }
            Set<String> visited = new HashSet<>();
            visited.add(sitemapUri.toString());
            return collectPageUrls(content, sitemapUri, 0, visited);
        } catch (Exception e) {
            log.debug("Sitemap not available at {}: {}", sitemapUri, e.getMessage());
            return Set.of();
        }
    }

    private Set<String> collectPageUrls(byte[] content, URI source, int depth, Set<String> visited)
            throws UnknownFormatException, IOException {
        List<String> locations = parseLocations(content, source);
        if (depth >= properties.maxDepth() || locations.stream().noneMatch(SitemapResolver::isSitemapReference)) {
            return new LinkedHashSet<>(locations);
        }

        Set<String> pageUrls = new LinkedHashSet<>();
        for (String location : locations) {
            if (isSitemapReference(location)) {
                if (visited.add(location)) {
                    pageUrls.addAll(fetchSubSitemap(location, depth + 1, visited));
                }
            } else if (properties.indexPolicy() == SitemapProperties.IndexPolicy.MIXED) {
                pageUrls.add(location);
            } else {
                log.debug("Dropping {} listed next to sub-sitemaps in {}", location, source);
            }
        }
        return pageUrls;
    }

    private Set<String> fetchSubSitemap(String location, int depth, Set<String> visited) {
        try {
            URI uri = URI.create(location);
            byte[] content = fetchSitemap(uri);
            if (content == null) {
                return Set.of();
            }
            return collectPageUrls(content, uri, depth, visited);
        } catch (Exception e) {
            log.warn("Error fetching sub-sitemap {}: {}", location, e.getMessage());
            return Set.of();
        }
    }

    /**
     * Fetch sitemap content with size limit to prevent OOM on giant sitemaps.
     */
    private byte @Nullable [] fetchSitemap(URI sitemapUri) {
        byte[] content = httpClient.get()
                .uri(sitemapUri)
                .retrieve()
                .body(byte[].class);
        if (content == null || content.length == 0) {
            return null;
        }
        if (content.length > properties.maxSitemapSizeBytes()) {
            log.warn("Sitemap at {} exceeds size limit ({} bytes > {} bytes), skipping",
                    sitemapUri, content.length, properties.maxSitemapSizeBytes());
            return null;
        }
        return content;
    }

    private List<String> parseLocations(byte[] content, URI source)
            throws UnknownFormatException, IOException {
        SiteMapParser parser = new SiteMapParser(false);
        AbstractSiteMap parsed = parser.parseSiteMap(content, source.toURL());

        if (parsed instanceof SiteMapIndex index) {
            return index.getSitemaps().stream()
                    .map(AbstractSiteMap::getUrl)
                    .map(URL::toString)
                    .toList();
        }
        if (parsed instanceof SiteMap siteMap) {
            return siteMap.getSiteMapUrls().stream()
                    .map(SiteMapURL::getUrl)
                    .map(URL::toString)
                    .toList();
        }
        return List.of();
    }

    private static boolean isSitemapReference(String location) {
        return location.trim().endsWith(".xml");
    }
}
