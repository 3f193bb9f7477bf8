package dev.harvester.render;

/** The browser did not deliver the page within its page timeout. */
public class RenderTimeoutException extends RuntimeException {

  public RenderTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
