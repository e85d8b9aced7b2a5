package io.statusmvp.tokenbalances.controller;

import io.statusmvp.tokenbalances.model.ContractPricesResponse;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.TokenBalanceService;
import io.statusmvp.tokenbalances.service.price.PriceService;
import jakarta.validation.constraints.NotBlank;
import java.util.Arrays;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class PriceController {
  private final PriceService prices;

  public PriceController(PriceService prices) {
    this.prices = prices;
  }

  @GetMapping("/prices/by-contract")
  public Mono<ContractPricesResponse> getPricesByContract(
      @RequestParam(value = "chain", required = false, defaultValue = "base") String chain,
      @RequestParam("addresses") @NotBlank String addresses) {
    SupportedChain resolved = TokenBalanceService.resolveChain(chain);
    List<String> list =
        Arrays.stream(addresses.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .map(TokenBalanceService::normalizeAddress)
            .toList();
    return Mono.fromCallable(
            () -> new ContractPricesResponse(resolved.id(), prices.getPrices(resolved, list)))
        .subscribeOn(Schedulers.boundedElastic());
  }
}
