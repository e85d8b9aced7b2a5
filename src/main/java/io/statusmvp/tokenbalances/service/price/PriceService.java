package io.statusmvp.tokenbalances.service.price;

import io.statusmvp.tokenbalances.client.PriceOracle;
import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.BackgroundTasks;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import io.statusmvp.tokenbalances.service.cache.PriceCache;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * USD prices by contract address: fresh Price Cache entries first, then the oracle fallback chain
 * for whatever is still missing.
 */
@Service
public class PriceService {
  private static final Logger log = LoggerFactory.getLogger(PriceService.class);

  private final List<PriceOracle> oracles;
  private final PriceCache priceCache;
  private final BackgroundTasks backgroundTasks;
  private final BalanceMetrics metrics;

  public PriceService(
      List<PriceOracle> oracles,
      PriceCache priceCache,
      BackgroundTasks backgroundTasks,
      BalanceMetrics metrics,
      BalancesProperties properties) {
    this.oracles = order(oracles, properties.getPriceSources());
    this.priceCache = priceCache;
    this.backgroundTasks = backgroundTasks;
    this.metrics = metrics;
  }

  /**
   * Known prices for {@code addresses}, keyed by lowercased address. Unknown addresses are absent.
   * Newly fetched prices are merged into the Price Cache in the background.
   */
  public Map<String, Double> getPrices(SupportedChain chain, List<String> addresses) {
    List<String> wanted = normalize(addresses);
    Map<String, Double> out = new HashMap<>();
    if (wanted.isEmpty()) return out;

    Map<String, Double> cached = priceCache.getFresh(chain);
    List<String> missing = new ArrayList<>();
    for (String address : wanted) {
      Double price = cached.get(address);
      if (PriceCache.isKnownPrice(price)) {
        out.put(address, price);
      } else {
        missing.add(address);
      }
    }
    if (missing.isEmpty()) return out;

    Map<String, Double> fetched = fetchPrices(chain, missing);
    out.putAll(fetched);
    log.info(
        "prices chain={} requested={} cached={} fetched={} unknown={}",
        chain.id(),
        wanted.size(),
        wanted.size() - missing.size(),
        fetched.size(),
        missing.size() - fetched.size());

    if (!fetched.isEmpty()) {
      backgroundTasks.submit(
          "price cache merge chain=" + chain.id(), () -> priceCache.merge(chain, fetched));
    }
    return out;
  }

  /**
   * Oracle fallback chain, bypassing the cache. Each oracle is asked only for the addresses no
   * earlier oracle answered with a usable price; a failing oracle counts as answering nothing.
   */
  public Map<String, Double> fetchPrices(SupportedChain chain, List<String> addresses) {
    Map<String, Double> out = new HashMap<>();
    List<String> remaining = normalize(addresses);
    for (PriceOracle oracle : oracles) {
      if (remaining.isEmpty()) break;
      Map<String, Double> answered;
      try {
        answered = oracle.fetchUsdPrices(chain, remaining);
      } catch (Exception e) {
        metrics.sourceFailure("price." + oracle.name());
        log.warn(
            "Price oracle {} failed for chain={} addresses={}",
            oracle.name(),
            chain.id(),
            remaining.size(),
            e);
        continue;
      }
      if (answered == null) continue;
      List<String> stillMissing = new ArrayList<>();
      for (String address : remaining) {
        Double price = answered.get(address);
        if (PriceCache.isKnownPrice(price)) {
          out.put(address, price);
        } else {
          stillMissing.add(address);
        }
      }
      log.debug(
          "Price oracle {} answered {} of {} for chain={}",
          oracle.name(),
          remaining.size() - stillMissing.size(),
          remaining.size(),
          chain.id());
      remaining = stillMissing;
    }
    return out;
  }

  private static List<String> normalize(List<String> addresses) {
    if (addresses == null) return List.of();
    LinkedHashSet<String> set = new LinkedHashSet<>();
    for (String a : addresses) {
      if (a != null && !a.isBlank()) set.add(a.trim().toLowerCase(Locale.ROOT));
    }
    return new ArrayList<>(set);
  }

  private static List<PriceOracle> order(List<PriceOracle> available, List<String> names) {
    Map<String, PriceOracle> byName =
        available.stream().collect(Collectors.toMap(PriceOracle::name, Function.identity()));
    List<PriceOracle> out = new ArrayList<>();
    for (String name : names) {
      PriceOracle oracle = byName.get(name);
      if (oracle == null) {
        throw new IllegalStateException(
            "Unknown price source '" + name + "' in app.balances.price-sources; known: " + byName.keySet());
      }
      out.add(oracle);
    }
    return List.copyOf(out);
  }
}
