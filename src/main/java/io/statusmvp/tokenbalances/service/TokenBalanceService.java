package io.statusmvp.tokenbalances.service;

import io.statusmvp.tokenbalances.client.BalancesProvider;
import io.statusmvp.tokenbalances.client.LogoLookup;
import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.error.MissingCredentialException;
import io.statusmvp.tokenbalances.error.TokenMetadataException;
import io.statusmvp.tokenbalances.error.UnsupportedChainException;
import io.statusmvp.tokenbalances.model.CachedTokenMetadata;
import io.statusmvp.tokenbalances.model.RawTokenBalance;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.model.TokenBalance;
import io.statusmvp.tokenbalances.model.TokenMetadata;
import io.statusmvp.tokenbalances.service.cache.MetadataCache;
import io.statusmvp.tokenbalances.service.cache.WalletCache;
import io.statusmvp.tokenbalances.service.logo.LogoResolver;
import io.statusmvp.tokenbalances.service.price.PriceService;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Builds a wallet's display-ready token list: raw balances from the provider, metadata and logos
 * from the Metadata Cache or fetched in bounded parallel batches, prices from {@link
 * PriceService}, then USD valuation, dust filtering and ordering. The finished list is memoised in
 * the Wallet Cache.
 *
 * <p>Only the raw balance query and the core metadata of newly seen tokens are required; every
 * other stage degrades to a less complete token.
 */
@Service
public class TokenBalanceService {
  private static final Logger log = LoggerFactory.getLogger(TokenBalanceService.class);

  static final String DEFAULT_CHAIN = "base";
  private static final long METADATA_RETRIES = 1;
  private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

  private final BalancesProvider balancesProvider;
  private final MetadataCache metadataCache;
  private final WalletCache walletCache;
  private final PriceService priceService;
  private final LogoResolver logoResolver;
  private final ImageCacheService imageCacheService;
  private final BackgroundTasks backgroundTasks;
  private final BalancesProperties properties;
  private final Clock clock;

  public TokenBalanceService(
      BalancesProvider balancesProvider,
      MetadataCache metadataCache,
      WalletCache walletCache,
      PriceService priceService,
      LogoResolver logoResolver,
      ImageCacheService imageCacheService,
      BackgroundTasks backgroundTasks,
      BalancesProperties properties,
      Clock clock) {
    properties.validate();
    this.balancesProvider = balancesProvider;
    this.metadataCache = metadataCache;
    this.walletCache = walletCache;
    this.priceService = priceService;
    this.logoResolver = logoResolver;
    this.imageCacheService = imageCacheService;
    this.backgroundTasks = backgroundTasks;
    this.properties = properties;
    this.clock = clock;
  }

  public static SupportedChain resolveChain(String chainId) {
    String id = (chainId == null || chainId.isBlank()) ? DEFAULT_CHAIN : chainId;
    return SupportedChain.fromId(id).orElseThrow(() -> new UnsupportedChainException(chainId));
  }

  public static String normalizeAddress(String address) {
    String a = address == null ? "" : address.trim();
    if (!EVM_ADDRESS.matcher(a).matches()) {
      throw new IllegalArgumentException("Invalid EVM address: " + address);
    }
    return a.toLowerCase(Locale.ROOT);
  }

  public List<TokenBalance> getBalances(String chainId, String address, boolean forceRefresh) {
    SupportedChain chain = resolveChain(chainId);
    String wallet = normalizeAddress(address);
    if (!balancesProvider.isEnabled()) throw new MissingCredentialException("ALCHEMY_API_KEY");

    if (!forceRefresh) {
      Optional<List<TokenBalance>> cached = walletCache.get(chain, wallet);
      if (cached.isPresent()) return cached.get();
    }

    Map<String, BigInteger> holdings = nonZeroHoldings(balancesProvider.getTokenBalances(wallet, chain));

    Map<String, CachedTokenMetadata> known = metadataCache.getAll(chain);
    long now = clock.millis();
    List<String> needsMetadata = new ArrayList<>();
    List<String> logoRetry = new ArrayList<>();
    int retryEligible = 0;
    for (String contract : holdings.keySet()) {
      CachedTokenMetadata md = known.get(contract);
      if (md == null) {
        needsMetadata.add(contract);
      } else if (logoRetryDue(md, now)) {
        retryEligible++;
        if (logoRetry.size() < properties.getLogoRetryCap()) logoRetry.add(contract);
      }
    }
    log.info(
        "balances chain={} wallet={} nonZero={} cached={} needsMetadata={} logoRetry={}/{}",
        chain.id(),
        wallet,
        holdings.size(),
        holdings.size() - needsMetadata.size(),
        needsMetadata.size(),
        logoRetry.size(),
        retryEligible);

    Map<String, CachedTokenMetadata> updates = new LinkedHashMap<>();
    List<String> failed = new ArrayList<>();
    for (Enrichment e : enrichNew(chain, needsMetadata)) {
      if (e.metadata().isPresent() && e.metadata().get().complete()) {
        TokenMetadata md = e.metadata().get();
        updates.put(
            e.contract(),
            new CachedTokenMetadata(
                md.symbol(), md.name(), md.decimals(), e.logo().orElse(null), now));
      } else {
        failed.add(e.contract());
      }
    }
    for (Map.Entry<String, Optional<String>> e : retryLogos(chain, logoRetry).entrySet()) {
      updates.put(e.getKey(), known.get(e.getKey()).withLogo(e.getValue().orElse(null), now));
    }

    if (!updates.isEmpty()) persistMetadata(chain, updates);
    if (!failed.isEmpty()) {
      log.warn("incomplete metadata: chain={} contracts={}", chain.id(), failed);
      throw new TokenMetadataException(failed);
    }

    List<TokenBalance> tokens = new ArrayList<>();
    for (Map.Entry<String, BigInteger> h : holdings.entrySet()) {
      CachedTokenMetadata md = updates.getOrDefault(h.getKey(), known.get(h.getKey()));
      tokens.add(
          new TokenBalance(
              h.getKey(),
              md.symbol(),
              md.name(),
              md.decimals(),
              h.getValue().toString(),
              null,
              null,
              md.logoUrl()));
    }

    Map<String, Double> prices =
        priceService.getPrices(chain, new ArrayList<>(holdings.keySet()));
    List<TokenBalance> valued =
        tokens.stream().map(t -> TokenRanking.applyPrice(t, prices.get(t.contractAddress()))).toList();
    List<TokenBalance> kept =
        TokenRanking.filterDust(valued, properties.getMinTokenBalance(), properties.getMinValueUsd());
    List<TokenBalance> sorted = TokenRanking.sortByValue(kept);
    log.info(
        "balances chain={} wallet={} priced={} unpriced={} dustFiltered={}->{}",
        chain.id(),
        wallet,
        prices.size(),
        holdings.size() - prices.size(),
        valued.size(),
        sorted.size());

    walletCache.put(chain, wallet, sorted);
    return sorted;
  }

  /** Strictly positive balances keyed by lowercased contract; the first row wins on duplicates. */
  static Map<String, BigInteger> nonZeroHoldings(List<RawTokenBalance> rows) {
    Map<String, BigInteger> out = new LinkedHashMap<>();
    if (rows == null) return out;
    for (RawTokenBalance row : rows) {
      if (row == null || row.contractAddress() == null) continue;
      BigInteger amount = row.amount();
      if (amount.signum() <= 0) continue;
      out.putIfAbsent(row.contractAddress().trim().toLowerCase(Locale.ROOT), amount);
    }
    return out;
  }

  private boolean logoRetryDue(CachedTokenMetadata md, long now) {
    if (md.hasLogo()) return false;
    Long checkedAt = md.logoCheckedAt();
    return checkedAt == null || now - checkedAt >= properties.getLogoRetryInterval().toMillis();
  }

  /** Metadata and logo per token, requested concurrently, in batches of bounded size. */
  private List<Enrichment> enrichNew(SupportedChain chain, List<String> contracts) {
    return inBatches(contracts, contract -> enrichOne(chain, contract));
  }

  private Mono<Enrichment> enrichOne(SupportedChain chain, String contract) {
    // Shared with the provider logo source so the metadata call happens once.
    // One retry before the token counts as failed.
    Mono<TokenMetadata> providerMetadata =
        Mono.fromCallable(() -> balancesProvider.getTokenMetadata(contract, chain))
            .subscribeOn(Schedulers.boundedElastic())
            .retry(METADATA_RETRIES)
            .cache();

    Mono<Optional<TokenMetadata>> metadata =
        providerMetadata
            .map(Optional::of)
            .onErrorResume(
                e -> {
                  log.warn("metadata fetch failed: chain={} contract={}", chain.id(), contract, e);
                  return Mono.just(Optional.empty());
                })
            .defaultIfEmpty(Optional.empty());
    Mono<Optional<String>> logo =
        Mono.fromCallable(
                () -> logoResolver.resolve(new LogoLookup(contract, chain, providerMetadata)))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> Mono.just(Optional.empty()));

    return Mono.zip(metadata, logo).map(t -> new Enrichment(contract, t.getT1(), t.getT2()));
  }

  private Map<String, Optional<String>> retryLogos(SupportedChain chain, List<String> contracts) {
    Map<String, Optional<String>> out = new HashMap<>();
    List<Map.Entry<String, Optional<String>>> results =
        inBatches(
            contracts,
            contract ->
                Mono.fromCallable(() -> logoResolver.resolve(contract, chain))
                    .subscribeOn(Schedulers.boundedElastic())
                    .onErrorResume(e -> Mono.just(Optional.empty()))
                    .map(logo -> Map.entry(contract, logo)));
    results.forEach(e -> out.put(e.getKey(), e.getValue()));
    return out;
  }

  private <T> List<T> inBatches(List<String> contracts, Function<String, Mono<T>> task) {
    List<T> out = new ArrayList<>();
    int batchSize = properties.getEnrichmentBatchSize();
    for (int i = 0; i < contracts.size(); i += batchSize) {
      List<String> batch = contracts.subList(i, Math.min(contracts.size(), i + batchSize));
      List<T> results = Flux.fromIterable(batch).flatMap(task, batchSize).collectList().block();
      if (results != null) out.addAll(results);
    }
    return out;
  }

  /** Detached: merge into the Metadata Cache, then re-host new logo URLs. */
  private void persistMetadata(SupportedChain chain, Map<String, CachedTokenMetadata> updates) {
    Map<String, CachedTokenMetadata> snapshot = Map.copyOf(updates);
    backgroundTasks.submit(
        "metadata merge chain=" + chain.id() + " entries=" + snapshot.size(),
        () -> {
          metadataCache.merge(chain, snapshot);
          if (!imageCacheService.isEnabled()) return;
          snapshot.forEach(
              (contract, md) -> {
                if (!md.hasLogo()) return;
                imageCacheService
                    .cacheBestEffort(md.logoUrl())
                    .filter(hosted -> !hosted.equals(md.logoUrl()))
                    .ifPresent(
                        hosted -> metadataCache.replaceLogo(chain, contract, md.logoUrl(), hosted));
              });
        });
  }

  private record Enrichment(
      String contract, Optional<TokenMetadata> metadata, Optional<String> logo) {}
}
