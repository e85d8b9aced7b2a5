package io.statusmvp.tokenbalances.service.cache;

/** The backend could not be read, so the current value is unknown (not absent). */
public class CacheReadException extends Exception {
  public CacheReadException(String key, Throwable cause) {
    super("cache read failed for " + key, cause);
  }
}
