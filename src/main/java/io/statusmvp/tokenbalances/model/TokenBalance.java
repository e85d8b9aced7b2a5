package io.statusmvp.tokenbalances.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One display-ready wallet token.
 *
 * <p>{@code balance} is the raw integer amount as a decimal string. A {@code priceUsd} of null or 0
 * means the price is unknown; {@code balanceUsd} is only set when the price is known.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenBalance(
    String contractAddress,
    String symbol,
    String name,
    int decimals,
    String balance,
    Double priceUsd,
    Double balanceUsd,
    String logoUrl) {

  public boolean priced() {
    return priceUsd != null && priceUsd > 0;
  }

  public TokenBalance withValuation(Double priceUsd, Double balanceUsd) {
    return new TokenBalance(
        contractAddress, symbol, name, decimals, balance, priceUsd, balanceUsd, logoUrl);
  }
}
