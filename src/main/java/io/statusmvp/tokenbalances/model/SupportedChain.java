package io.statusmvp.tokenbalances.model;

import java.util.Locale;
import java.util.Optional;

/** EVM chains the balance pipeline can serve, with each upstream's identifier for the chain. */
public enum SupportedChain {
  ETHEREUM("ethereum", "eth-mainnet", "ethereum", "ethereum", "ethereum"),
  BASE("base", "base-mainnet", "base", "base", "base"),
  BSC("bsc", "bnb-mainnet", "binance-smart-chain", "smartchain", "bsc");

  private final String id;
  private final String alchemyNetwork;
  private final String coingeckoPlatform;
  private final String trustwalletChain;
  private final String defillamaChain;

  SupportedChain(
      String id,
      String alchemyNetwork,
      String coingeckoPlatform,
      String trustwalletChain,
      String defillamaChain) {
    this.id = id;
    this.alchemyNetwork = alchemyNetwork;
    this.coingeckoPlatform = coingeckoPlatform;
    this.trustwalletChain = trustwalletChain;
    this.defillamaChain = defillamaChain;
  }

  public String id() {
    return id;
  }

  public String alchemyNetwork() {
    return alchemyNetwork;
  }

  public String coingeckoPlatform() {
    return coingeckoPlatform;
  }

  public String trustwalletChain() {
    return trustwalletChain;
  }

  public String defillamaChain() {
    return defillamaChain;
  }

  public static Optional<SupportedChain> fromId(String id) {
    if (id == null || id.isBlank()) return Optional.empty();
    String normalized = id.trim().toLowerCase(Locale.ROOT);
    for (SupportedChain chain : values()) {
      if (chain.id.equals(normalized)) return Optional.of(chain);
    }
    return Optional.empty();
  }
}
