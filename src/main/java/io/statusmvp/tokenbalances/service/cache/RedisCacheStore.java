package io.statusmvp.tokenbalances.service.cache;

import java.time.Duration;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisCacheStore implements CacheStore {
  private static final Duration MIN_TTL = Duration.ofSeconds(1);

  private final StringRedisTemplate redis;

  public RedisCacheStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public Optional<String> get(String key) {
    if (key == null) return Optional.empty();
    return Optional.ofNullable(redis.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttlHint) {
    if (key == null || value == null) return;
    if (ttlHint == null || ttlHint.isZero() || ttlHint.isNegative()) {
      redis.opsForValue().set(key, value);
      return;
    }
    redis.opsForValue().set(key, value, ttlHint.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttlHint);
  }
}
