package io.statusmvp.tokenbalances.client;

/** Transport or protocol failure talking to a third-party source. */
public class UpstreamException extends RuntimeException {
  public UpstreamException(String message) {
    super(message);
  }

  public UpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
