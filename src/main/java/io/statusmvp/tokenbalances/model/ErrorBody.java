package io.statusmvp.tokenbalances.model;

public record ErrorBody(String error) {}
