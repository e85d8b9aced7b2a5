package io.statusmvp.tokenbalances.service.price;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.statusmvp.tokenbalances.client.PriceOracle;
import io.statusmvp.tokenbalances.client.UpstreamException;
import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.BackgroundTasks;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import io.statusmvp.tokenbalances.service.cache.JsonCache;
import io.statusmvp.tokenbalances.service.cache.PriceCache;
import io.statusmvp.tokenbalances.testsupport.InMemoryCacheStore;
import io.statusmvp.tokenbalances.testsupport.MutableClock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

class PriceServiceTest {
  private static final String A = "0x" + "a".repeat(40);
  private static final String B = "0x" + "b".repeat(40);
  private static final SupportedChain CHAIN = SupportedChain.ETHEREUM;

  private PriceOracle defillama;
  private PriceOracle coingecko;
  private PriceCache priceCache;
  private BalancesProperties properties;
  private BalanceMetrics metrics;
  private BackgroundTasks tasks;

  @BeforeEach
  void setUp() {
    defillama = mock(PriceOracle.class);
    when(defillama.name()).thenReturn("defillama");
    when(defillama.fetchUsdPrices(any(), anyList())).thenReturn(Map.of());
    coingecko = mock(PriceOracle.class);
    when(coingecko.name()).thenReturn("coingecko");
    when(coingecko.fetchUsdPrices(any(), anyList())).thenReturn(Map.of());

    properties = new BalancesProperties();
    metrics = new BalanceMetrics(new SimpleMeterRegistry());
    tasks = new BackgroundTasks(Schedulers.immediate());
    JsonCache json = new JsonCache(new InMemoryCacheStore(), new ObjectMapper(), metrics);
    priceCache =
        new PriceCache(json, metrics, new MutableClock(Instant.parse("2026-02-01T00:00:00Z")), properties);
  }

  private PriceService service() {
    return new PriceService(List.of(coingecko, defillama), priceCache, tasks, metrics, properties);
  }

  @Test
  void secondaryOnlySeesWhatPrimaryLeftUnanswered() {
    when(defillama.fetchUsdPrices(CHAIN, List.of(A, B))).thenReturn(Map.of(A, 1.0, B, 0.0));
    when(coingecko.fetchUsdPrices(CHAIN, List.of(B))).thenReturn(Map.of(B, 2.0));

    Map<String, Double> prices = service().fetchPrices(CHAIN, List.of(A, B.toUpperCase().replace("0X", "0x")));

    assertEquals(Map.of(A, 1.0, B, 2.0), prices);
    verify(coingecko).fetchUsdPrices(CHAIN, List.of(B));
  }

  @Test
  void secondaryIsSkippedWhenPrimaryAnswersEverything() {
    when(defillama.fetchUsdPrices(CHAIN, List.of(A))).thenReturn(Map.of(A, 1.0));

    service().fetchPrices(CHAIN, List.of(A));

    verify(coingecko, never()).fetchUsdPrices(any(), anyList());
  }

  @Test
  void oracleFailuresLeaveAddressesUnknown() {
    when(defillama.fetchUsdPrices(any(), anyList())).thenThrow(new UpstreamException("down"));
    when(coingecko.fetchUsdPrices(any(), anyList())).thenThrow(new UpstreamException("429"));

    assertEquals(Map.of(), service().getPrices(CHAIN, List.of(A)));
  }

  @Test
  void cachedPricesAreServedWithoutOracles() {
    priceCache.merge(CHAIN, Map.of(A, 5.0));

    Map<String, Double> prices = service().getPrices(CHAIN, List.of(A));

    assertEquals(Map.of(A, 5.0), prices);
    verify(defillama, never()).fetchUsdPrices(any(), anyList());
  }

  @Test
  void fetchedPricesAreMergedIntoCache() {
    priceCache.merge(CHAIN, Map.of(A, 5.0));
    when(defillama.fetchUsdPrices(CHAIN, List.of(B))).thenReturn(Map.of(B, 7.0));

    service().getPrices(CHAIN, List.of(A, B));

    assertEquals(Map.of(A, 5.0, B, 7.0), priceCache.getFresh(CHAIN));
  }

  @Test
  void unknownPriceSourceFailsFast() {
    properties.setPriceSources(List.of("defillama", "binance"));

    assertThrows(IllegalStateException.class, this::service);
  }
}
