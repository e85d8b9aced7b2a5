package io.statusmvp.tokenbalances.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Typed, fail-open access to the {@link CacheStore}. Backend errors and unreadable payloads come
 * back as a miss and are logged; writes report failure through their return value only.
 * Read-merge-write callers use {@link #readForUpdate} so a failed read never turns into a clobber.
 */
@Component
public class JsonCache {
  private static final Logger log = LoggerFactory.getLogger(JsonCache.class);

  private final CacheStore store;
  private final ObjectMapper mapper;
  private final BalanceMetrics metrics;

  public JsonCache(CacheStore store, ObjectMapper mapper, BalanceMetrics metrics) {
    this.store = store;
    this.mapper = mapper;
    this.metrics = metrics;
  }

  public <T> Optional<T> read(String tier, String key, Class<T> type) {
    try {
      return readForUpdate(tier, key, type);
    } catch (CacheReadException e) {
      return Optional.empty();
    }
  }

  /**
   * Like {@link #read} but reports a backend failure instead of a miss, for callers about to
   * overwrite the value with a merged copy. An unreadable payload is still a miss.
   */
  public <T> Optional<T> readForUpdate(String tier, String key, Class<T> type)
      throws CacheReadException {
    Optional<String> raw;
    try {
      raw = store.get(key);
    } catch (RuntimeException e) {
      log.warn("cache read failed: tier={} key={}", tier, key, e);
      metrics.cacheResult(tier, "error");
      throw new CacheReadException(key, e);
    }
    if (raw.isEmpty() || raw.get().isBlank()) return Optional.empty();
    try {
      return Optional.ofNullable(mapper.readValue(raw.get(), type));
    } catch (JsonProcessingException e) {
      log.warn("discarding unreadable cache value: tier={} key={} error={}", tier, key, e.getOriginalMessage());
      metrics.cacheResult(tier, "error");
      return Optional.empty();
    }
  }

  public boolean write(String tier, String key, Object value, Duration ttlHint) {
    try {
      store.set(key, mapper.writeValueAsString(value), ttlHint);
      return true;
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("cache write failed: tier={} key={}", tier, key, e);
      metrics.cacheResult(tier, "error");
      return false;
    }
  }
}
