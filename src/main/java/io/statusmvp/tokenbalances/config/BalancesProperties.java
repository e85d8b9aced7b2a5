package io.statusmvp.tokenbalances.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Tuning knobs of the balance pipeline: cache lifetimes, dust thresholds and fallback orders. */
@Component
@ConfigurationProperties(prefix = "app.balances")
public class BalancesProperties {
  private Duration walletCacheTtl = Duration.ofMinutes(15);
  private Duration priceCacheTtl = Duration.ofMinutes(15);
  private Duration logoRetryInterval = Duration.ofHours(24);
  private int logoRetryCap = 10;
  private int enrichmentBatchSize = 20;
  private double minTokenBalance = 1d;
  private double minValueUsd = 0.001d;
  private List<String> priceSources = new ArrayList<>(List.of("defillama", "coingecko"));
  private List<String> logoSources =
      new ArrayList<>(List.of("trustwallet", "alchemy", "coingecko"));
  private String httpCacheControl = "private, s-maxage=60, stale-while-revalidate=300";

  /** Rejects combinations the pipeline cannot honour. */
  public void validate() {
    if (walletCacheTtl == null || priceCacheTtl == null || logoRetryInterval == null) {
      throw new IllegalStateException("app.balances cache durations must be set");
    }
    if (walletCacheTtl.compareTo(priceCacheTtl) > 0) {
      throw new IllegalStateException(
          "app.balances.wallet-cache-ttl ("
              + walletCacheTtl
              + ") must not exceed app.balances.price-cache-ttl ("
              + priceCacheTtl
              + ")");
    }
    if (enrichmentBatchSize < 1) {
      throw new IllegalStateException("app.balances.enrichment-batch-size must be positive");
    }
    if (logoRetryCap < 0) {
      throw new IllegalStateException("app.balances.logo-retry-cap must not be negative");
    }
  }

  public Duration getWalletCacheTtl() {
    return walletCacheTtl;
  }

  public void setWalletCacheTtl(Duration walletCacheTtl) {
    this.walletCacheTtl = walletCacheTtl;
  }

  public Duration getPriceCacheTtl() {
    return priceCacheTtl;
  }

  public void setPriceCacheTtl(Duration priceCacheTtl) {
    this.priceCacheTtl = priceCacheTtl;
  }

  public Duration getLogoRetryInterval() {
    return logoRetryInterval;
  }

  public void setLogoRetryInterval(Duration logoRetryInterval) {
    this.logoRetryInterval = logoRetryInterval;
  }

  public int getLogoRetryCap() {
    return logoRetryCap;
  }

  public void setLogoRetryCap(int logoRetryCap) {
    this.logoRetryCap = logoRetryCap;
  }

  public int getEnrichmentBatchSize() {
    return enrichmentBatchSize;
  }

  public void setEnrichmentBatchSize(int enrichmentBatchSize) {
    this.enrichmentBatchSize = enrichmentBatchSize;
  }

  public double getMinTokenBalance() {
    return minTokenBalance;
  }

  public void setMinTokenBalance(double minTokenBalance) {
    this.minTokenBalance = minTokenBalance;
  }

  public double getMinValueUsd() {
    return minValueUsd;
  }

  public void setMinValueUsd(double minValueUsd) {
    this.minValueUsd = minValueUsd;
  }

  public List<String> getPriceSources() {
    return priceSources;
  }

  public void setPriceSources(List<String> priceSources) {
    this.priceSources = normalizeNames(priceSources);
  }

  public List<String> getLogoSources() {
    return logoSources;
  }

  public void setLogoSources(List<String> logoSources) {
    this.logoSources = normalizeNames(logoSources);
  }

  public String getHttpCacheControl() {
    return httpCacheControl;
  }

  public void setHttpCacheControl(String httpCacheControl) {
    this.httpCacheControl = httpCacheControl;
  }

  private static List<String> normalizeNames(List<String> names) {
    List<String> out = new ArrayList<>();
    if (names == null) return out;
    for (String n : names) {
      if (n == null || n.isBlank()) continue;
      String v = n.trim().toLowerCase(Locale.ROOT);
      if (!out.contains(v)) out.add(v);
    }
    return out;
  }
}
