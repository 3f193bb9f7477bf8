package dev.harvester.task;

/** A submission asked for a capability this service does not offer. */
public class UnsupportedFeatureException extends RuntimeException {

  public UnsupportedFeatureException(String message) {
    super(message);
  }
}
