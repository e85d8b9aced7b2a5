package io.statusmvp.tokenbalances.client;

import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.model.TokenMetadata;
import reactor.core.publisher.Mono;

/**
 * A logo lookup for one contract. {@code providerMetadata}, when set, is a shared in-flight
 * metadata call that sources can reuse instead of issuing their own.
 */
public record LogoLookup(
    String contractAddress, SupportedChain chain, Mono<TokenMetadata> providerMetadata) {

  public static LogoLookup of(String contractAddress, SupportedChain chain) {
    return new LogoLookup(contractAddress, chain, null);
  }
}
