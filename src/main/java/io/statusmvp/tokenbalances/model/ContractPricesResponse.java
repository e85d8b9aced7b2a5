package io.statusmvp.tokenbalances.model;

import java.util.Map;

public record ContractPricesResponse(String chain, Map<String, Double> prices) {}
