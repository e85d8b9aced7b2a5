package io.statusmvp.tokenbalances.model;

import java.math.BigInteger;

/** Balance row exactly as the balances provider reports it. */
public record RawTokenBalance(String contractAddress, String rawBalanceHex) {

  /** Parses the hex (or decimal) amount; {@code 0x}, blank and unparseable values read as zero. */
  public BigInteger amount() {
    String s = rawBalanceHex == null ? "" : rawBalanceHex.trim();
    if (s.isEmpty()) return BigInteger.ZERO;
    try {
      if (s.startsWith("0x") || s.startsWith("0X")) {
        String hex = s.substring(2);
        return hex.isEmpty() ? BigInteger.ZERO : new BigInteger(hex, 16);
      }
      return new BigInteger(s);
    } catch (NumberFormatException e) {
      return BigInteger.ZERO;
    }
  }
}
