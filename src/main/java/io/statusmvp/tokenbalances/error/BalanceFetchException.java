package io.statusmvp.tokenbalances.error;

/** The raw balance query failed; there is no fallback for it. */
public class BalanceFetchException extends ApiException {
  public BalanceFetchException(String message) {
    super(message, 502);
  }

  public BalanceFetchException(String message, Throwable cause) {
    super(message, 502, cause);
  }
}
