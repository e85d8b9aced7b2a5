package io.statusmvp.tokenbalances.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/** USD prices for one chain, keyed by lowercased contract address. Only positive prices are stored. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkPriceCache(Map<String, Double> prices, long cachedAt) {}
