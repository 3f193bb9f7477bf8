package dev.harvester.render;

/**
 * Renders a page in a real browser and hands back its DOM as HTML together with the links and
 * images the browser saw.
 *
 * <p>Implementations report a page the browser could not load as a non-successful {@link
 * RenderedPage}, and a render that ran past its page timeout as a {@link RenderTimeoutException}.
 * Transport failures propagate as unchecked exceptions.
 */
public interface PageRenderer {

  RenderedPage render(String url, RenderOptions options);
}
