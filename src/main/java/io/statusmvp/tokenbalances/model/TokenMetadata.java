package io.statusmvp.tokenbalances.model;

/** Token metadata as returned by the balances provider; any field may be missing. */
public record TokenMetadata(String symbol, String name, Integer decimals, String logo) {

  public boolean complete() {
    return symbol != null
        && !symbol.isBlank()
        && name != null
        && !name.isBlank()
        && decimals != null
        && decimals >= 0;
  }
}
