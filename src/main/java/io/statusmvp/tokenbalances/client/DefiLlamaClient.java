package io.statusmvp.tokenbalances.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.service.BalanceMetrics;
import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** DefiLlama coins API. Free, no key, batches many {@code chain:address} coins per call. */
@Component
public class DefiLlamaClient implements PriceOracle {
  private static final Logger log = LoggerFactory.getLogger(DefiLlamaClient.class);

  // Keeps the request path well under common URL length limits.
  private static final int MAX_COINS_PER_CALL = 100;

  private final WebClient webClient;
  private final String baseUrl;
  private final Duration timeout;
  private final BalanceMetrics metrics;

  public DefiLlamaClient(
      WebClient webClient,
      BalanceMetrics metrics,
      @Value("${app.defillama.base-url:https://coins.llama.fi}") String baseUrl,
      @Value("${app.defillama.timeout-ms:10000}") long timeoutMs) {
    this.webClient = webClient;
    this.metrics = metrics;
    this.baseUrl = (baseUrl == null ? "" : baseUrl.trim()).replaceAll("/+$", "");
    this.timeout = Duration.ofMillis(Math.max(1000L, timeoutMs));
  }

  @Override
  public String name() {
    return "defillama";
  }

  /**
   * Prices for every chunk that answered. A failed chunk only loses its own addresses; the call
   * throws when no chunk answered at all.
   */
  @Override
  public Map<String, Double> fetchUsdPrices(SupportedChain chain, List<String> addresses) {
    Map<String, Double> out = new HashMap<>();
    if (addresses == null || addresses.isEmpty()) return out;
    int chunks = 0;
    int failures = 0;
    UpstreamException lastFailure = null;
    for (int i = 0; i < addresses.size(); i += MAX_COINS_PER_CALL) {
      List<String> chunk = addresses.subList(i, Math.min(addresses.size(), i + MAX_COINS_PER_CALL));
      chunks++;
      try {
        out.putAll(fetchChunk(chain, chunk));
      } catch (UpstreamException e) {
        failures++;
        lastFailure = e;
        metrics.sourceFailure("price.defillama.chunk");
        log.warn("DefiLlama chunk of {} failed for chain={}", chunk.size(), chain.id(), e);
      }
    }
    if (failures == chunks) throw lastFailure;
    log.debug("DefiLlama returned {} of {} prices for chain={}", out.size(), addresses.size(), chain.id());
    return out;
  }

  private Map<String, Double> fetchChunk(SupportedChain chain, List<String> addresses) {
    String coins =
        addresses.stream()
            .map(a -> chain.defillamaChain() + ":" + a.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(","));
    URI uri = URI.create(baseUrl + "/prices/current/" + coins);

    JsonNode root;
    try {
      root = webClient.get().uri(uri).retrieve().bodyToMono(JsonNode.class).timeout(timeout).block();
    } catch (RuntimeException e) {
      throw new UpstreamException("DefiLlama price request failed for chain=" + chain.id(), e);
    }

    Map<String, Double> out = new HashMap<>();
    if (root == null) return out;
    JsonNode coinsNode = root.path("coins");
    if (!coinsNode.isObject()) return out;
    coinsNode
        .fields()
        .forEachRemaining(
            entry -> {
              String key = entry.getKey();
              int colon = key.indexOf(':');
              if (colon < 0 || colon == key.length() - 1) return;
              JsonNode price = entry.getValue().path("price");
              if (!price.isNumber()) return;
              out.put(key.substring(colon + 1).toLowerCase(Locale.ROOT), price.asDouble());
            });
    return out;
  }
}
