package io.statusmvp.tokenbalances.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.statusmvp.tokenbalances.model.SupportedChain;
import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * CoinGecko contract endpoints. Used as the secondary price oracle and the last logo source.
 *
 * <p>Uses the Pro API when a key is configured, the rate-limited public API otherwise.
 */
@Component
public class CoinGeckoClient implements PriceOracle, LogoSource {
  private static final Logger log = LoggerFactory.getLogger(CoinGeckoClient.class);

  private static final String PRO_BASE_URL = "https://pro-api.coingecko.com/api/v3";
  private static final String PUBLIC_BASE_URL = "https://api.coingecko.com/api/v3";

  private final WebClient webClient;
  private final String apiKey;
  private final String baseUrl;
  private final Duration priceTimeout;
  private final Duration logoTimeout;

  public CoinGeckoClient(
      WebClient webClient,
      @Value("${app.coingecko.api-key:}") String apiKey,
      @Value("${app.coingecko.price-timeout-ms:10000}") long priceTimeoutMs,
      @Value("${app.coingecko.logo-timeout-ms:3000}") long logoTimeoutMs) {
    this.webClient = webClient;
    this.apiKey = apiKey == null ? "" : apiKey.trim();
    this.baseUrl = this.apiKey.isBlank() ? PUBLIC_BASE_URL : PRO_BASE_URL;
    this.priceTimeout = Duration.ofMillis(Math.max(1000L, priceTimeoutMs));
    this.logoTimeout = Duration.ofMillis(Math.max(500L, logoTimeoutMs));
  }

  @Override
  public String name() {
    return "coingecko";
  }

  /** Contract prices via {@code /simple/token_price/{platform}}, keyed by lowercased address. */
  @Override
  public Map<String, Double> fetchUsdPrices(SupportedChain chain, List<String> addresses) {
    Map<String, Double> out = new HashMap<>();
    if (addresses == null || addresses.isEmpty()) return out;

    String csv = String.join(",", addresses).toLowerCase(Locale.ROOT);
    URI uri =
        UriComponentsBuilder.fromUriString(
                baseUrl + "/simple/token_price/" + chain.coingeckoPlatform())
            .queryParam("contract_addresses", csv)
            .queryParam("vs_currencies", "usd")
            .build(true)
            .toUri();

    JsonNode root;
    try {
      root =
          webClient
              .get()
              .uri(uri)
              .headers(this::applyKey)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(priceTimeout)
              .block();
    } catch (RuntimeException e) {
      throw new UpstreamException(
          "CoinGecko token_price request failed for platform=" + chain.coingeckoPlatform(), e);
    }
    if (root == null || !root.isObject()) {
      log.warn(
          "CoinGecko token_price returned invalid body for platform='{}' body={}",
          chain.coingeckoPlatform(),
          root);
      return out;
    }

    root.fieldNames()
        .forEachRemaining(
            addr -> {
              JsonNode usd = root.path(addr).path("usd");
              if (usd.isNumber()) out.put(addr.toLowerCase(Locale.ROOT), usd.asDouble());
            });
    return out;
  }

  /** Token image via {@code /coins/{platform}/contract/{address}}; a 404 means no listing. */
  @Override
  public Optional<String> find(LogoLookup lookup) {
    String address = lookup.contractAddress().toLowerCase(Locale.ROOT);
    URI uri =
        URI.create(
            baseUrl + "/coins/" + lookup.chain().coingeckoPlatform() + "/contract/" + address);

    JsonNode root;
    try {
      root =
          webClient
              .get()
              .uri(uri)
              .headers(this::applyKey)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(logoTimeout)
              .block();
    } catch (WebClientResponseException.NotFound e) {
      return Optional.empty();
    } catch (RuntimeException e) {
      throw new UpstreamException("CoinGecko contract lookup failed for " + address, e);
    }
    if (root == null) return Optional.empty();

    JsonNode image = root.path("image");
    for (String size : List.of("small", "thumb", "large")) {
      String url = image.path(size).asText("").trim();
      if (url.startsWith("http")) return Optional.of(url);
    }
    return Optional.empty();
  }

  private void applyKey(HttpHeaders h) {
    if (!apiKey.isBlank()) h.set("x-cg-pro-api-key", apiKey);
  }
}
