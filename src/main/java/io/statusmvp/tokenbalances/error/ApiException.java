package io.statusmvp.tokenbalances.error;

/** A request-level failure that maps onto a specific HTTP status. */
public class ApiException extends RuntimeException {
  private final int httpStatus;

  public ApiException(String message, int httpStatus) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public ApiException(String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
  }

  public int getHttpStatus() {
    return httpStatus;
  }
}
