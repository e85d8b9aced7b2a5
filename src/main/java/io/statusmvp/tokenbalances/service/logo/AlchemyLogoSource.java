package io.statusmvp.tokenbalances.service.logo;

import io.statusmvp.tokenbalances.client.BalancesProvider;
import io.statusmvp.tokenbalances.client.LogoLookup;
import io.statusmvp.tokenbalances.client.LogoSource;
import io.statusmvp.tokenbalances.model.TokenMetadata;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Logo field of the balances provider's token metadata. */
@Component
public class AlchemyLogoSource implements LogoSource {
  private final BalancesProvider balancesProvider;
  private final Duration timeout;

  public AlchemyLogoSource(
      BalancesProvider balancesProvider,
      @Value("${app.alchemy.metadata-timeout-ms:5000}") long timeoutMs) {
    this.balancesProvider = balancesProvider;
    this.timeout = Duration.ofMillis(Math.max(500L, timeoutMs));
  }

  @Override
  public String name() {
    return "alchemy";
  }

  @Override
  public Optional<String> find(LogoLookup lookup) {
    if (!balancesProvider.isEnabled()) return Optional.empty();

    Mono<TokenMetadata> metadata = lookup.providerMetadata();
    if (metadata == null) {
      metadata =
          Mono.fromCallable(
                  () -> balancesProvider.getTokenMetadata(lookup.contractAddress(), lookup.chain()))
              .subscribeOn(Schedulers.boundedElastic());
    }
    TokenMetadata md = metadata.timeout(timeout).block();
    if (md == null || md.logo() == null || md.logo().isBlank()) return Optional.empty();
    return Optional.of(md.logo().trim());
  }
}
