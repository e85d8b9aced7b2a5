package io.statusmvp.tokenbalances.controller;

import io.statusmvp.tokenbalances.config.BalancesProperties;
import io.statusmvp.tokenbalances.model.BalancesResponse;
import io.statusmvp.tokenbalances.service.TokenBalanceService;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
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
public class BalanceController {
  private final TokenBalanceService balances;
  private final String cacheControl;

  public BalanceController(TokenBalanceService balances, BalancesProperties properties) {
    this.balances = balances;
    this.cacheControl = properties.getHttpCacheControl();
  }

  @GetMapping("/balances")
  public Mono<ResponseEntity<BalancesResponse>> getBalances(
      @RequestParam(value = "chain", required = false, defaultValue = "base") String chain,
      @RequestParam("address") @NotBlank String address,
      @RequestParam(value = "refresh", required = false, defaultValue = "false") boolean refresh) {
    return Mono.fromCallable(() -> balances.getBalances(chain, address, refresh))
        .subscribeOn(Schedulers.boundedElastic())
        .map(
            tokens ->
                ResponseEntity.ok()
                    .header(HttpHeaders.CACHE_CONTROL, cacheControl)
                    .body(new BalancesResponse(tokens)));
  }
}
