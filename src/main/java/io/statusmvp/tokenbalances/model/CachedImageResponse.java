package io.statusmvp.tokenbalances.model;

public record CachedImageResponse(String cachedUrl) {}
