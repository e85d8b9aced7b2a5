package io.statusmvp.tokenbalances.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/** All known token metadata for one chain, keyed by lowercased contract address. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkMetadataCache(Map<String, CachedTokenMetadata> metadata) {}
