package io.statusmvp.tokenbalances.service;

import io.statusmvp.tokenbalances.model.TokenBalance;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Valuation, dust filtering and display order of a wallet's tokens. */
public final class TokenRanking {
  private TokenRanking() {}

  /** Raw integer balance scaled by {@code 10^decimals}, exact. */
  public static BigDecimal humanBalance(TokenBalance token) {
    BigInteger raw;
    try {
      raw = new BigInteger(token.balance());
    } catch (RuntimeException e) {
      return BigDecimal.ZERO;
    }
    return new BigDecimal(raw).movePointLeft(Math.max(0, token.decimals()));
  }

  /** Sets {@code priceUsd} and {@code balanceUsd} when the price is known, clears them otherwise. */
  public static TokenBalance applyPrice(TokenBalance token, Double priceUsd) {
    if (priceUsd == null || !Double.isFinite(priceUsd) || priceUsd <= 0) {
      return token.withValuation(null, null);
    }
    double balanceUsd = humanBalance(token).doubleValue() * priceUsd;
    return token.withValuation(priceUsd, balanceUsd);
  }

  /**
   * Keeps a token when its human balance reaches {@code minTokenBalance} and, for priced tokens
   * only, its USD value reaches {@code minValueUsd}.
   */
  public static List<TokenBalance> filterDust(
      List<TokenBalance> tokens, double minTokenBalance, double minValueUsd) {
    BigDecimal minBalance = BigDecimal.valueOf(minTokenBalance);
    List<TokenBalance> out = new ArrayList<>();
    for (TokenBalance t : tokens) {
      if (humanBalance(t).compareTo(minBalance) < 0) continue;
      if (t.priced() && (t.balanceUsd() == null || t.balanceUsd() < minValueUsd)) continue;
      out.add(t);
    }
    return out;
  }

  /** Priced first by USD value, then unpriced by human balance, both descending. Stable. */
  public static List<TokenBalance> sortByValue(List<TokenBalance> tokens) {
    List<TokenBalance> out = new ArrayList<>(tokens);
    out.sort(DISPLAY_ORDER);
    return out;
  }

  static final Comparator<TokenBalance> DISPLAY_ORDER =
      (a, b) -> {
        if (a.priced() != b.priced()) return a.priced() ? -1 : 1;
        if (a.priced()) {
          return Double.compare(usd(b), usd(a));
        }
        return humanBalance(b).compareTo(humanBalance(a));
      };

  private static double usd(TokenBalance t) {
    return t.balanceUsd() == null ? 0d : t.balanceUsd();
  }
}
