package io.statusmvp.tokenbalances.model;

import java.util.List;

public record BalancesResponse(List<TokenBalance> tokens) {}
