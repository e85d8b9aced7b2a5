package io.statusmvp.tokenbalances.service;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class BalanceMetrics {
  private final MeterRegistry meterRegistry;

  public BalanceMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** result is one of hit, miss, error. */
  public void cacheResult(String tier, String result) {
    meterRegistry.counter("balances.cache", "tier", tier, "result", result).increment();
  }

  public void sourceFailure(String source) {
    meterRegistry.counter("balances.source.failure", "source", source).increment();
  }

  public void logoResolved(String source) {
    meterRegistry.counter("balances.logo.resolved", "source", source).increment();
  }

  public void imageCached(String result) {
    meterRegistry.counter("balances.image.cached", "result", result).increment();
  }
}
