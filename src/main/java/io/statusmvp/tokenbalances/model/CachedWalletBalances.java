package io.statusmvp.tokenbalances.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CachedWalletBalances(List<TokenBalance> tokens, long cachedAt) {}
