package io.statusmvp.tokenbalances.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value backend shared by every cache tier.
 *
 * <p>Expiry is enforced by the tiers against their own {@code cachedAt}; {@code ttlHint} only lets
 * the backend reclaim space. A null or non-positive hint means keep forever. Implementations may
 * throw on backend failure.
 */
public interface CacheStore {
  Optional<String> get(String key);

  void set(String key, String value, Duration ttlHint);
}
