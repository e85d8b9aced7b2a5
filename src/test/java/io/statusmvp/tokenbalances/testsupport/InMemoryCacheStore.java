package io.statusmvp.tokenbalances.testsupport;

import io.statusmvp.tokenbalances.service.cache.CacheStore;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCacheStore implements CacheStore {
  private final Map<String, String> values = new ConcurrentHashMap<>();
  private volatile boolean failing;
  private volatile boolean failNextGet;
  private int writes;

  @Override
  public Optional<String> get(String key) {
    if (failNextGet) {
      failNextGet = false;
      throw new IllegalStateException("cache read timed out");
    }
    if (failing) throw new IllegalStateException("cache backend down");
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public synchronized void set(String key, String value, Duration ttlHint) {
    if (failing) throw new IllegalStateException("cache backend down");
    values.put(key, value);
    writes++;
  }

  public void put(String key, String value) {
    values.put(key, value);
  }

  public void remove(String key) {
    values.remove(key);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  public String raw(String key) {
    return values.get(key);
  }

  public synchronized int writes() {
    return writes;
  }

  /** The next {@link #get} throws; writes keep working. */
  public void failNextGet() {
    this.failNextGet = true;
  }

  public void setFailing(boolean failing) {
    this.failing = failing;
  }
}
