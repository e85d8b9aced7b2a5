package io.statusmvp.tokenbalances.client;

import java.util.Optional;

public interface LogoSource {
  /** Name used in {@code app.balances.logo-sources}. */
  String name();

  /**
   * @return the logo URL, or empty when this source has none for the token
   * @throws RuntimeException on transport failures; callers treat that as "none"
   */
  Optional<String> find(LogoLookup lookup);
}
