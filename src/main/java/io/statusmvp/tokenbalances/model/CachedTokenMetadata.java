package io.statusmvp.tokenbalances.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Permanently cached ERC-20 metadata for one contract.
 *
 * <p>symbol/name/decimals never change once written; only the logo fields are rewritten.
 * {@code logoCheckedAt} is the unix-ms time of the last logo lookup, successful or not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CachedTokenMetadata(
    String symbol, String name, Integer decimals, String logoUrl, Long logoCheckedAt) {

  public boolean wellFormed() {
    return symbol != null
        && !symbol.isBlank()
        && name != null
        && !name.isBlank()
        && decimals != null
        && decimals >= 0;
  }

  public boolean hasLogo() {
    return logoUrl != null && !logoUrl.isBlank();
  }

  public CachedTokenMetadata withLogo(String logoUrl, Long logoCheckedAt) {
    return new CachedTokenMetadata(symbol, name, decimals, logoUrl, logoCheckedAt);
  }

  /** Keeps this entry's symbol/name/decimals and takes the newer logo state from {@code update}. */
  public CachedTokenMetadata mergedWith(CachedTokenMetadata update) {
    if (update == null) return this;
    if (update.hasLogo()) {
      return withLogo(update.logoUrl(), update.logoCheckedAt());
    }
    if (hasLogo()) return this;
    long mine = logoCheckedAt == null ? 0L : logoCheckedAt;
    long theirs = update.logoCheckedAt() == null ? 0L : update.logoCheckedAt();
    return theirs > mine ? withLogo(null, update.logoCheckedAt()) : this;
  }
}
