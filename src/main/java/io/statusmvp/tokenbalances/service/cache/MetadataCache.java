package io.statusmvp.tokenbalances.service.cache;

import io.statusmvp.tokenbalances.model.BulkMetadataCache;
import io.statusmvp.tokenbalances.model.CachedTokenMetadata;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Permanent per-chain metadata map, stored as a single bulk entry so a request costs one read and
 * at most one write however many tokens the wallet holds.
 */
@Component
public class MetadataCache {
  private static final Logger log = LoggerFactory.getLogger(MetadataCache.class);
  static final String TIER = "metadata";

  private final JsonCache cache;
  private final BalanceMetrics metrics;

  public MetadataCache(JsonCache cache, BalanceMetrics metrics) {
    this.cache = cache;
    this.metrics = metrics;
  }

  static String key(SupportedChain chain) {
    return "evm-metadata-bulk:" + chain.id();
  }

  /** Well-formed entries only; malformed ones are dropped as if never cached. */
  public Map<String, CachedTokenMetadata> getAll(SupportedChain chain) {
    BulkMetadataCache bulk = cache.read(TIER, key(chain), BulkMetadataCache.class).orElse(null);
    if (bulk == null || bulk.metadata() == null) {
      metrics.cacheResult(TIER, "miss");
      return new HashMap<>();
    }
    metrics.cacheResult(TIER, "hit");
    return wellFormedEntries(chain, bulk);
  }

  /**
   * Read-merge-write: applies {@code updates} on top of the currently persisted map. Existing
   * entries keep their symbol/name/decimals and only take logo changes. Nothing is written when
   * the current map cannot be read.
   */
  public void merge(SupportedChain chain, Map<String, CachedTokenMetadata> updates) {
    if (updates == null || updates.isEmpty()) return;
    Optional<Map<String, CachedTokenMetadata>> current = readForUpdate(chain);
    if (current.isEmpty()) {
      log.warn("metadata merge skipped, current map unreadable: chain={} updates={}", chain.id(), updates.size());
      return;
    }
    Map<String, CachedTokenMetadata> merged = current.get();
    for (Map.Entry<String, CachedTokenMetadata> e : updates.entrySet()) {
      if (e.getValue() == null || !e.getValue().wellFormed()) continue;
      String address = e.getKey().toLowerCase(Locale.ROOT);
      CachedTokenMetadata existing = merged.get(address);
      merged.put(address, existing == null ? e.getValue() : existing.mergedWith(e.getValue()));
    }
    if (cache.write(TIER, key(chain), new BulkMetadataCache(merged), Duration.ZERO)) {
      log.debug("metadata cache merged: chain={} updates={} total={}", chain.id(), updates.size(), merged.size());
    }
  }

  /**
   * Swaps one token's logo URL for its re-hosted copy, but only while the entry still points at
   * {@code originalUrl}.
   */
  public void replaceLogo(
      SupportedChain chain, String contractAddress, String originalUrl, String hostedUrl) {
    String address = contractAddress.toLowerCase(Locale.ROOT);
    Optional<Map<String, CachedTokenMetadata>> current = readForUpdate(chain);
    if (current.isEmpty()) {
      log.warn("logo replacement skipped, current map unreadable: chain={} contract={}", chain.id(), address);
      return;
    }
    Map<String, CachedTokenMetadata> entries = current.get();
    CachedTokenMetadata entry = entries.get(address);
    if (entry == null || originalUrl == null || !originalUrl.equals(entry.logoUrl())) return;
    entries.put(address, entry.withLogo(hostedUrl, entry.logoCheckedAt()));
    cache.write(TIER, key(chain), new BulkMetadataCache(entries), Duration.ZERO);
  }

  /** Current well-formed entries, or empty when the backend could not be read. */
  private Optional<Map<String, CachedTokenMetadata>> readForUpdate(SupportedChain chain) {
    try {
      BulkMetadataCache bulk =
          cache.readForUpdate(TIER, key(chain), BulkMetadataCache.class).orElse(null);
      return Optional.of(wellFormedEntries(chain, bulk));
    } catch (CacheReadException e) {
      return Optional.empty();
    }
  }

  private static Map<String, CachedTokenMetadata> wellFormedEntries(
      SupportedChain chain, BulkMetadataCache bulk) {
    Map<String, CachedTokenMetadata> out = new HashMap<>();
    if (bulk == null || bulk.metadata() == null) return out;
    int dropped = 0;
    for (Map.Entry<String, CachedTokenMetadata> e : bulk.metadata().entrySet()) {
      if (e.getKey() == null || e.getValue() == null || !e.getValue().wellFormed()) {
        dropped++;
        continue;
      }
      out.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
    }
    if (dropped > 0) {
      log.warn("ignored {} malformed metadata entries for chain={}", dropped, chain.id());
    }
    return out;
  }
}
