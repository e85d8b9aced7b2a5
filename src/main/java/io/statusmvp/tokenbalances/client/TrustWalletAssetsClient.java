package io.statusmvp.tokenbalances.client;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.web3j.crypto.Keys;
import reactor.core.publisher.Mono;

/**
 * Trust Wallet assets repository. Logos live at a deterministic path keyed by the EIP-55
 * checksummed address, so a lookup is a single existence probe.
 */
@Component
public class TrustWalletAssetsClient implements LogoSource {
  private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

  private final WebClient webClient;
  private final String baseUrl;
  private final Duration timeout;

  public TrustWalletAssetsClient(
      WebClient webClient,
      @Value(
              "${app.trustwallet.base-url:https://raw.githubusercontent.com/trustwallet/assets/master}")
          String baseUrl,
      @Value("${app.trustwallet.timeout-ms:2000}") long timeoutMs) {
    this.webClient = webClient;
    this.baseUrl = (baseUrl == null ? "" : baseUrl.trim()).replaceAll("/+$", "");
    this.timeout = Duration.ofMillis(Math.max(200L, timeoutMs));
  }

  @Override
  public String name() {
    return "trustwallet";
  }

  @Override
  public Optional<String> find(LogoLookup lookup) {
    String checksummed = checksumAddress(lookup.contractAddress());
    if (checksummed == null) return Optional.empty();

    String url =
        baseUrl
            + "/blockchains/"
            + lookup.chain().trustwalletChain()
            + "/assets/"
            + checksummed
            + "/logo.png";

    // Ranged GET for the first byte instead of HEAD.
    Integer status;
    try {
      status =
          webClient
              .get()
              .uri(URI.create(url))
              .header(HttpHeaders.RANGE, "bytes=0-0")
              .exchangeToMono(
                  res -> res.releaseBody().then(Mono.just(res.statusCode().value())))
              .timeout(timeout)
              .block();
    } catch (RuntimeException e) {
      throw new UpstreamException("Trust Wallet probe failed for " + url, e);
    }
    if (status == null) return Optional.empty();
    if (status == 200 || status == 206) return Optional.of(url);
    if (status == 404) return Optional.empty();
    throw new UpstreamException("Trust Wallet probe returned HTTP " + status + " for " + url);
  }

  /** EIP-55 form of {@code address}, or null when it is not a 20-byte hex address. */
  static String checksumAddress(String address) {
    if (address == null || !EVM_ADDRESS.matcher(address.trim()).matches()) return null;
    return Keys.toChecksumAddress(address.trim().toLowerCase());
  }
}
