package io.statusmvp.tokenbalances.service.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import io.statusmvp.tokenbalances.testsupport.InMemoryCacheStore;
import io.statusmvp.tokenbalances.testsupport.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PriceCacheTest {
  private static final SupportedChain CHAIN = SupportedChain.BASE;

  private InMemoryCacheStore store;
  private MutableClock clock;
  private SimpleMeterRegistry registry;
  private PriceCache cache;

  @BeforeEach
  void setUp() {
    store = new InMemoryCacheStore();
    clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
    registry = new SimpleMeterRegistry();
    BalanceMetrics metrics = new BalanceMetrics(registry);
    cache =
        new PriceCache(
            new JsonCache(store, new ObjectMapper(), metrics), metrics, clock, new BalancesProperties());
  }

  @Test
  void expiresAfterTtl() {
    cache.merge(CHAIN, Map.of("0xaa", 1.0));
    clock.advance(Duration.ofMinutes(14));
    assertEquals(Map.of("0xaa", 1.0), cache.getFresh(CHAIN));

    clock.advance(Duration.ofMinutes(1));
    assertTrue(cache.getFresh(CHAIN).isEmpty());
  }

  @Test
  void zeroAndNonFinitePricesNeverOverwriteKnownOnes() {
    cache.merge(CHAIN, Map.of("0xaa", 3.0));
    Map<String, Double> update = new HashMap<>();
    update.put("0xAA", 0.0);
    update.put("0xbb", Double.POSITIVE_INFINITY);
    update.put("0xcc", null);

    cache.merge(CHAIN, update);

    assertEquals(Map.of("0xaa", 3.0), cache.getFresh(CHAIN));
  }

  @Test
  void keysAreLowercasedPerChain() {
    cache.merge(CHAIN, Map.of("0xAbC", 2.0));

    assertEquals(Map.of("0xabc", 2.0), cache.getFresh(CHAIN));
    assertTrue(cache.getFresh(SupportedChain.BSC).isEmpty());
    assertTrue(store.contains("evm-prices-bulk:base"));
  }

  @Test
  void unreadableEntryIsAMiss() {
    store.put(PriceCache.key(CHAIN), "{not json");

    assertTrue(cache.getFresh(CHAIN).isEmpty());
    assertEquals(1.0, registry.counter("balances.cache", "tier", "price", "result", "error").count());
  }

  @Test
  void failedReadNeverOverwritesFreshPrices() {
    cache.merge(CHAIN, Map.of("0xaa", 1.0, "0xbb", 2.0));
    int writesBefore = store.writes();

    store.failNextGet();
    cache.merge(CHAIN, Map.of("0xcc", 3.0));

    assertEquals(writesBefore, store.writes());
    assertEquals(Map.of("0xaa", 1.0, "0xbb", 2.0), cache.getFresh(CHAIN));
  }
}
