package io.statusmvp.tokenbalances.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Blob store reached over plain HTTP: objects are written with an authenticated PUT to {@code
 * upload-url}/path and read back publicly from {@code public-base-url}/path.
 */
@Component
public class HttpBlobStore implements BlobStore {
  private final WebClient webClient;
  private final String uploadUrl;
  private final String publicBaseUrl;
  private final String token;
  private final Duration timeout;

  public HttpBlobStore(
      WebClient webClient,
      @Value("${app.blob.upload-url:}") String uploadUrl,
      @Value("${app.blob.public-base-url:}") String publicBaseUrl,
      @Value("${app.blob.token:}") String token,
      @Value("${app.blob.timeout-ms:5000}") long timeoutMs) {
    this.webClient = webClient;
    this.uploadUrl = trimSlashes(uploadUrl);
    this.publicBaseUrl = trimSlashes(publicBaseUrl);
    this.token = token == null ? "" : token.trim();
    this.timeout = Duration.ofMillis(Math.max(1000L, timeoutMs));
  }

  @Override
  public boolean isEnabled() {
    return !uploadUrl.isBlank() && !publicBaseUrl.isBlank() && !token.isBlank();
  }

  @Override
  public boolean isHosted(String url) {
    if (publicBaseUrl.isBlank() || url == null) return false;
    try {
      String host = URI.create(url.trim()).getHost();
      return host != null && host.equalsIgnoreCase(URI.create(publicBaseUrl).getHost());
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  @Override
  public Optional<String> head(String path) {
    String url = publicBaseUrl + "/" + path;
    Integer status;
    try {
      status =
          webClient
              .head()
              .uri(URI.create(url))
              .exchangeToMono(
                  res -> res.releaseBody().then(Mono.just(res.statusCode().value())))
              .timeout(timeout)
              .block();
    } catch (RuntimeException e) {
      throw new UpstreamException("Blob HEAD failed for " + path, e);
    }
    if (status != null && status >= 200 && status < 300) return Optional.of(url);
    if (status == null || status == 404 || status == 403) return Optional.empty();
    throw new UpstreamException("Blob HEAD returned HTTP " + status + " for " + path);
  }

  @Override
  public String put(String path, byte[] bytes, String contentType) {
    JsonNode root;
    try {
      root =
          webClient
              .put()
              .uri(URI.create(uploadUrl + "/" + path))
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
              .contentType(MediaType.parseMediaType(contentType))
              .bodyValue(bytes)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .block();
    } catch (RuntimeException e) {
      throw new UpstreamException("Blob PUT failed for " + path, e);
    }
    String url = root == null ? "" : root.path("url").asText("").trim();
    return url.isBlank() ? publicBaseUrl + "/" + path : url;
  }

  private static String trimSlashes(String value) {
    return Objects.requireNonNullElse(value, "").trim().replaceAll("/+$", "");
  }
}
