package io.statusmvp.tokenbalances.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.statusmvp.tokenbalances.error.BalanceFetchException;
import io.statusmvp.tokenbalances.error.MissingCredentialException;
import io.statusmvp.tokenbalances.model.RawTokenBalance;
import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.model.TokenMetadata;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Alchemy token API: {@code alchemy_getTokenBalances} and {@code alchemy_getTokenMetadata}. */
@Component
public class AlchemyClient implements BalancesProvider {
  private static final Logger log = LoggerFactory.getLogger(AlchemyClient.class);

  private static final int MAX_PAGES = 10;

  private final WebClient webClient;
  private final String apiKey;
  private final String urlTemplate;
  private final Duration balancesTimeout;
  private final Duration metadataTimeout;

  public AlchemyClient(
      WebClient webClient,
      @Value("${app.alchemy.api-key:}") String apiKey,
      @Value("${app.alchemy.url-template:https://%s.g.alchemy.com/v2/%s}") String urlTemplate,
      @Value("${app.alchemy.balances-timeout-ms:10000}") long balancesTimeoutMs,
      @Value("${app.alchemy.metadata-timeout-ms:5000}") long metadataTimeoutMs) {
    this.webClient = webClient;
    this.apiKey = apiKey == null ? "" : apiKey.trim();
    this.urlTemplate = urlTemplate;
    this.balancesTimeout = Duration.ofMillis(Math.max(1000L, balancesTimeoutMs));
    this.metadataTimeout = Duration.ofMillis(Math.max(500L, metadataTimeoutMs));
  }

  @Override
  public boolean isEnabled() {
    return !apiKey.isBlank();
  }

  @Override
  public List<RawTokenBalance> getTokenBalances(String walletAddress, SupportedChain chain) {
    requireKey();
    List<RawTokenBalance> out = new ArrayList<>();
    String pageKey = null;
    int pages = 0;
    do {
      List<Object> params = new ArrayList<>(List.of(walletAddress, "erc20"));
      if (pageKey != null) params.add(Map.of("pageKey", pageKey));

      JsonNode root;
      try {
        root = call(chain, "alchemy_getTokenBalances", params, balancesTimeout);
      } catch (RuntimeException e) {
        throw new BalanceFetchException(
            "alchemy_getTokenBalances request failed for chain=" + chain.id(), e);
      }
      if (root == null) {
        throw new BalanceFetchException("alchemy_getTokenBalances returned an empty body");
      }
      if (hasError(root)) {
        throw new BalanceFetchException(
            "alchemy_getTokenBalances error: " + root.path("error").path("message").asText("unknown"));
      }
      JsonNode result = root.path("result");
      JsonNode rows = result.path("tokenBalances");
      if (!rows.isArray()) {
        throw new BalanceFetchException("alchemy_getTokenBalances response missing tokenBalances");
      }
      for (JsonNode row : rows) {
        String contract = blankToNull(row.path("contractAddress").asText(null));
        String balance = blankToNull(row.path("tokenBalance").asText(null));
        if (contract == null || balance == null) continue;
        out.add(new RawTokenBalance(contract, balance));
      }
      pageKey = blankToNull(result.path("pageKey").asText(null));
      pages++;
    } while (pageKey != null && pages < MAX_PAGES);

    if (pageKey != null) {
      log.warn(
          "alchemy_getTokenBalances truncated after {} pages: chain={} wallet={}",
          pages,
          chain.id(),
          walletAddress);
    }
    return out;
  }

  @Override
  public TokenMetadata getTokenMetadata(String contractAddress, SupportedChain chain) {
    requireKey();
    JsonNode root;
    try {
      root = call(chain, "alchemy_getTokenMetadata", List.of(contractAddress), metadataTimeout);
    } catch (RuntimeException e) {
      throw new UpstreamException(
          "alchemy_getTokenMetadata request failed for " + contractAddress, e);
    }
    if (root == null || hasError(root)) {
      throw new UpstreamException(
          "alchemy_getTokenMetadata returned an error for "
              + contractAddress
              + ": "
              + (root == null ? "empty body" : root.path("error").path("message").asText("unknown")));
    }
    JsonNode result = root.path("result");
    return new TokenMetadata(
        blankToNull(result.path("symbol").asText(null)),
        blankToNull(result.path("name").asText(null)),
        parseInt(result.path("decimals")),
        blankToNull(result.path("logo").asText(null)));
  }

  private JsonNode call(SupportedChain chain, String method, List<Object> params, Duration timeout) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("jsonrpc", "2.0");
    body.put("id", 1);
    body.put("method", method);
    body.put("params", params);

    return webClient
        .post()
        .uri(endpoint(chain))
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .block();
  }

  private URI endpoint(SupportedChain chain) {
    return URI.create(String.format(urlTemplate, chain.alchemyNetwork(), apiKey));
  }

  private void requireKey() {
    if (!isEnabled()) throw new MissingCredentialException("ALCHEMY_API_KEY");
  }

  private static boolean hasError(JsonNode root) {
    JsonNode error = root.path("error");
    return !error.isMissingNode() && !error.isNull();
  }

  private static Integer parseInt(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) return null;
    if (node.isNumber()) return node.asInt();
    String s = node.asText("").trim();
    if (s.isBlank()) return null;
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException ignored) {
      return null;
    }
  }

  private static String blankToNull(String value) {
    String v = value == null ? null : value.trim();
    return (v == null || v.isBlank()) ? null : v;
  }
}
