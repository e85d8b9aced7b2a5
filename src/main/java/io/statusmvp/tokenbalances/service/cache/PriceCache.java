package io.statusmvp.tokenbalances.service.cache;

import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.model.BulkPriceCache;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Short-lived per-chain USD price map. A zero or missing price means unknown and is never stored. */
@Component
public class PriceCache {
  private static final Logger log = LoggerFactory.getLogger(PriceCache.class);
  static final String TIER = "price";

  private final JsonCache cache;
  private final BalanceMetrics metrics;
  private final Clock clock;
  private final Duration ttl;

  public PriceCache(JsonCache cache, BalanceMetrics metrics, Clock clock, BalancesProperties properties) {
    this.cache = cache;
    this.metrics = metrics;
    this.clock = clock;
    this.ttl = properties.getPriceCacheTtl();
  }

  static String key(SupportedChain chain) {
    return "evm-prices-bulk:" + chain.id();
  }

  /** Prices from an entry younger than the TTL; empty when absent, expired or unreadable. */
  public Map<String, Double> getFresh(SupportedChain chain) {
    BulkPriceCache bulk = cache.read(TIER, key(chain), BulkPriceCache.class).orElse(null);
    if (!isFresh(bulk)) {
      metrics.cacheResult(TIER, "miss");
      return new HashMap<>();
    }
    Map<String, Double> out = knownPrices(bulk.prices());
    metrics.cacheResult(TIER, "hit");
    log.debug("price cache hit: chain={} prices={}", chain.id(), out.size());
    return out;
  }

  /**
   * Read-merge-write of this request's positive prices over the currently fresh map. Nothing is
   * written when the current map cannot be read.
   */
  public void merge(SupportedChain chain, Map<String, Double> newPrices) {
    if (newPrices == null || newPrices.isEmpty()) return;
    BulkPriceCache current;
    try {
      current = cache.readForUpdate(TIER, key(chain), BulkPriceCache.class).orElse(null);
    } catch (CacheReadException e) {
      log.warn("price merge skipped, current map unreadable: chain={} updates={}", chain.id(), newPrices.size());
      return;
    }
    Map<String, Double> merged = isFresh(current) ? knownPrices(current.prices()) : new HashMap<>();
    merged.putAll(knownPrices(newPrices));
    cache.write(TIER, key(chain), new BulkPriceCache(merged, clock.millis()), ttl);
  }

  private boolean isFresh(BulkPriceCache bulk) {
    if (bulk == null || bulk.prices() == null || bulk.cachedAt() <= 0) return false;
    return clock.millis() - bulk.cachedAt() < ttl.toMillis();
  }

  private static Map<String, Double> knownPrices(Map<String, Double> prices) {
    Map<String, Double> out = new HashMap<>();
    prices.forEach(
        (address, price) -> {
          if (address != null && isKnownPrice(price)) {
            out.put(address.toLowerCase(Locale.ROOT), price);
          }
        });
    return out;
  }

  public static boolean isKnownPrice(Double price) {
    return price != null && Double.isFinite(price) && price > 0;
  }
}
