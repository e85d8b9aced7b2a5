package io.statusmvp.tokenbalances.service.cache;

import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.model.CachedWalletBalances;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.model.TokenBalance;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Top-level memo: the finished token list for one (chain, wallet). */
@Component
public class WalletCache {
  private static final Logger log = LoggerFactory.getLogger(WalletCache.class);
  static final String TIER = "wallet";

  private final JsonCache cache;
  private final BalanceMetrics metrics;
  private final Clock clock;
  private final Duration ttl;

  public WalletCache(JsonCache cache, BalanceMetrics metrics, Clock clock, BalancesProperties properties) {
    this.cache = cache;
    this.metrics = metrics;
    this.clock = clock;
    this.ttl = properties.getWalletCacheTtl();
  }

  static String key(SupportedChain chain, String wallet) {
    return "evm-wallet:" + chain.id() + ":" + wallet.toLowerCase(Locale.ROOT);
  }

  public Optional<List<TokenBalance>> get(SupportedChain chain, String wallet) {
    CachedWalletBalances cached =
        cache.read(TIER, key(chain, wallet), CachedWalletBalances.class).orElse(null);
    if (cached == null || cached.tokens() == null || cached.cachedAt() <= 0) {
      metrics.cacheResult(TIER, "miss");
      return Optional.empty();
    }
    if (clock.millis() - cached.cachedAt() >= ttl.toMillis()) {
      metrics.cacheResult(TIER, "miss");
      return Optional.empty();
    }
    if (!cached.tokens().stream().allMatch(WalletCache::wellFormed)) {
      log.warn("discarding malformed wallet snapshot: chain={} wallet={}", chain.id(), wallet);
      metrics.cacheResult(TIER, "error");
      return Optional.empty();
    }
    metrics.cacheResult(TIER, "hit");
    log.info("wallet cache hit: chain={} wallet={} tokens={}", chain.id(), wallet, cached.tokens().size());
    return Optional.of(List.copyOf(cached.tokens()));
  }

  public void put(SupportedChain chain, String wallet, List<TokenBalance> tokens) {
    cache.write(TIER, key(chain, wallet), new CachedWalletBalances(List.copyOf(tokens), clock.millis()), ttl);
  }

  private static boolean wellFormed(TokenBalance token) {
    if (token == null || token.contractAddress() == null || token.symbol() == null) return false;
    if (token.decimals() < 0 || token.balance() == null) return false;
    try {
      return new BigInteger(token.balance()).signum() > 0;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
