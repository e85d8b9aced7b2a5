package io.statusmvp.tokenbalances.client;

import io.statusmvp.tokenbalances.model.RawTokenBalance;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.model.TokenMetadata;
import java.util.List;

public interface BalancesProvider {
  boolean isEnabled();

  /**
   * Every ERC-20 balance row for the wallet, zero rows included.
   *
   * @throws io.statusmvp.tokenbalances.error.BalanceFetchException when the query fails
   */
  List<RawTokenBalance> getTokenBalances(String walletAddress, SupportedChain chain);

  /** @throws UpstreamException when the provider cannot be reached or answers with an error */
  TokenMetadata getTokenMetadata(String contractAddress, SupportedChain chain);
}
