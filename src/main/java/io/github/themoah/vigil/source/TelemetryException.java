package io.github.themoah.vigil.source;

/**
 * Failure talking to an external collaborator: transport error, non-success status
 * or a response that does not have the expected shape.
 */
public class TelemetryException extends RuntimeException {

  public TelemetryException(String message) {
    super(message);
  }

  public TelemetryException(String message, Throwable cause) {
    super(message, cause);
  }
}
