package io.statusmvp.tokenbalances.error;

import java.util.List;

/** Core metadata (symbol, name, decimals) could not be obtained for newly seen tokens. */
public class TokenMetadataException extends ApiException {
  private final List<String> contractAddresses;

  public TokenMetadataException(List<String> contractAddresses) {
    super("Incomplete token metadata for " + String.join(",", contractAddresses), 502);
    this.contractAddresses = List.copyOf(contractAddresses);
  }

  public List<String> getContractAddresses() {
    return contractAddresses;
  }
}
