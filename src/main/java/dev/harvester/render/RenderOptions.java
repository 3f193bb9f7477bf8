package dev.harvester.render;

import org.jspecify.annotations.Nullable;

/**
 * Per-render browser settings.
 *
 * @param pageTimeoutMs page-level timeout handed to the browser
 * @param waitUntil load condition to wait for before the DOM is captured
 * @param sessionId browser session identifier isolating cookies and DOM state between concurrent
 *     renders, or null for a throwaway session
 */
public record RenderOptions(int pageTimeoutMs, WaitCondition waitUntil, @Nullable String sessionId) {

  public RenderOptions {
    if (pageTimeoutMs <= 0) {
      throw new IllegalArgumentException("pageTimeoutMs must be positive, got: " + pageTimeoutMs);
    }
    waitUntil = waitUntil == null ? WaitCondition.DOMCONTENTLOADED : waitUntil;
  }
}
