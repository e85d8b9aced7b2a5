package io.statusmvp.tokenbalances.client;

import io.statusmvp.tokenbalances.model.SupportedChain;
import java.util.List;
import java.util.Map;

public interface PriceOracle {
  /** Name used in {@code app.balances.price-sources}. */
  String name();

  /**
   * USD prices keyed by lowercased contract address. An address the source has no answer for is
   * absent from the map; a zero quote is returned as-is and left for the caller to discard.
   *
   * @throws UpstreamException when the source cannot be reached
   */
  Map<String, Double> fetchUsdPrices(SupportedChain chain, List<String> addresses);
}
