package io.statusmvp.tokenbalances.service.logo;

import io.statusmvp.tokenbalances.client.LogoLookup;
import io.statusmvp.tokenbalances.client.LogoSource;
import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tries the configured logo sources in order and returns the first URL found.
 *
 * <p>Each source fails independently: an exception or timeout from one source is logged and the
 * next source is tried. "No logo" is a normal result.
 */
@Service
public class LogoResolver {
  private static final Logger log = LoggerFactory.getLogger(LogoResolver.class);

  private final List<LogoSource> sources;
  private final BalanceMetrics metrics;

  public LogoResolver(
      List<LogoSource> sources, BalancesProperties properties, BalanceMetrics metrics) {
    this.sources = order(sources, properties.getLogoSources());
    this.metrics = metrics;
  }

  public Optional<String> resolve(String contractAddress, SupportedChain chain) {
    return resolve(LogoLookup.of(contractAddress, chain));
  }

  public Optional<String> resolve(LogoLookup lookup) {
    for (LogoSource source : sources) {
      Optional<String> url;
      try {
        url = source.find(lookup);
      } catch (Exception e) {
        metrics.sourceFailure("logo." + source.name());
        log.warn(
            "Logo source {} failed for {} on {}",
            source.name(),
            lookup.contractAddress(),
            lookup.chain().id(),
            e);
        continue;
      }
      if (url != null && url.isPresent() && !url.get().isBlank()) {
        log.debug("Logo for {} found via {}", lookup.contractAddress(), source.name());
        metrics.logoResolved(source.name());
        return url;
      }
      log.debug("Logo source {} has nothing for {}", source.name(), lookup.contractAddress());
    }
    metrics.logoResolved("none");
    return Optional.empty();
  }

  List<String> sourceNames() {
    return sources.stream().map(LogoSource::name).toList();
  }

  private static List<LogoSource> order(List<LogoSource> available, List<String> names) {
    Map<String, LogoSource> byName =
        available.stream().collect(Collectors.toMap(LogoSource::name, Function.identity()));
    List<LogoSource> out = new ArrayList<>();
    for (String name : names) {
      LogoSource source = byName.get(name);
      if (source == null) {
        throw new IllegalStateException(
            "Unknown logo source '" + name + "' in app.balances.logo-sources; known: " + byName.keySet());
      }
      out.add(source);
    }
    return List.copyOf(out);
  }
}
