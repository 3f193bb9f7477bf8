package dev.harvester.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects requests to {@code /crawl} and {@code /task/**} that lack the configured bearer token.
 * {@code /health} stays open. Tokens are compared in constant time.
 */
@Component
public class BearerTokenFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(BearerTokenFilter.class);

  private static final String BEARER_PREFIX = "Bearer ";

  private final boolean enabled;
  private final byte[] expectedToken;

  public BearerTokenFilter(AuthProperties properties) {
    this.enabled = properties.enabled();
    this.expectedToken =
        properties.token() == null
            ? new byte[0]
            : properties.token().getBytes(StandardCharsets.UTF_8);
    if (!enabled) {
      log.warn("API authentication is disabled: /crawl and /task are open to any caller");
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if (!enabled) {
      return true;
    }
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return !(path.equals("/crawl") || path.startsWith("/task/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header != null && header.startsWith(BEARER_PREFIX)) {
      byte[] presented = header.substring(BEARER_PREFIX.length()).trim()
          .getBytes(StandardCharsets.UTF_8);
      if (MessageDigest.isEqual(presented, expectedToken)) {
        chain.doFilter(request, response);
        return;
      }
    }
    log.debug("Rejected unauthenticated {} {}", request.getMethod(), request.getRequestURI());
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing or invalid bearer token");
  }
}
