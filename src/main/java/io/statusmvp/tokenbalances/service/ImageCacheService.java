package io.statusmvp.tokenbalances.service;

import io.statusmvp.tokenbalances.client.BlobStore;
import io.statusmvp.tokenbalances.error.ImageCacheException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Re-hosts remote token images in the blob store, content-addressed by the MD5 of the original URL
 * so the same source URL is downloaded at most once.
 */
@Service
public class ImageCacheService {
  private static final Logger log = LoggerFactory.getLogger(ImageCacheService.class);

  static final String PATH_PREFIX = "token-images/";
  private static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "webp", "svg");
  private static final Pattern EXTENSION = Pattern.compile("\\.([a-zA-Z0-9]+)$");
  private static final List<Pattern> IPFS_URL_PATTERNS =
      List.of(
          Pattern.compile("ipfs\\.io/ipfs/([a-zA-Z0-9]+)"),
          Pattern.compile("\\.mypinata\\.cloud/ipfs/([a-zA-Z0-9]+)"),
          Pattern.compile("cloudflare-ipfs\\.com/ipfs/([a-zA-Z0-9]+)"),
          Pattern.compile("dweb\\.link/ipfs/([a-zA-Z0-9]+)"),
          Pattern.compile("gateway\\.pinata\\.cloud/ipfs/([a-zA-Z0-9]+)"));
  private static final List<String> IPFS_GATEWAYS =
      List.of(
          "https://cloudflare-ipfs.com",
          "https://dweb.link",
          "https://gateway.pinata.cloud",
          "https://ipfs.io");
  private static final String USER_AGENT = "token-balances-backend/1.0";

  private final WebClient webClient;
  private final BlobStore blobStore;
  private final BalanceMetrics metrics;
  private final Duration downloadTimeout;

  public ImageCacheService(
      WebClient webClient,
      BlobStore blobStore,
      BalanceMetrics metrics,
      @Value("${app.images.download-timeout-ms:8000}") long downloadTimeoutMs) {
    this.webClient = webClient;
    this.blobStore = blobStore;
    this.metrics = metrics;
    this.downloadTimeout = Duration.ofMillis(Math.max(500L, downloadTimeoutMs));
  }

  public boolean isEnabled() {
    return blobStore.isEnabled();
  }

  /**
   * Hosted URL for {@code originalUrl}, downloading and storing it on first use.
   *
   * @throws ImageCacheException 400 when the URL has no usable image extension, 502 when the
   *     download or upload fails, 503 when no blob store is configured
   */
  public String cache(String originalUrl) {
    if (originalUrl == null || originalUrl.isBlank()) {
      throw ImageCacheException.unusableUrl("url is required");
    }
    String url = originalUrl.trim();
    if (blobStore.isHosted(url)) return url;
    if (!blobStore.isEnabled()) throw ImageCacheException.notConfigured();

    String path = blobPath(url);
    Optional<String> existing;
    try {
      existing = blobStore.head(path);
    } catch (RuntimeException e) {
      metrics.imageCached("error");
      throw ImageCacheException.upstream("Blob lookup failed for " + path, e);
    }
    if (existing.isPresent()) {
      metrics.imageCached("existing");
      return existing.get();
    }

    Download download = download(url);
    String hosted;
    try {
      hosted = blobStore.put(path, download.bytes(), download.contentType());
    } catch (RuntimeException e) {
      metrics.imageCached("error");
      throw ImageCacheException.upstream("Blob upload failed for " + path, e);
    }
    metrics.imageCached("stored");
    log.info("Cached image {} -> {}", url, hosted);
    return hosted;
  }

  /** Like {@link #cache(String)} but never throws; empty means "keep serving the original URL". */
  public Optional<String> cacheBestEffort(String originalUrl) {
    if (originalUrl == null || originalUrl.isBlank() || !isEnabled()) return Optional.empty();
    try {
      return Optional.of(cache(originalUrl));
    } catch (RuntimeException e) {
      log.warn("Image re-hosting failed for {}: {}", originalUrl, e.getMessage());
      return Optional.empty();
    }
  }

  /** {@code token-images/{md5(url)}.{ext}}; the hash is over the URL string, not the bytes. */
  static String blobPath(String url) {
    String hash = DigestUtils.md5DigestAsHex(url.getBytes(StandardCharsets.UTF_8));
    return PATH_PREFIX + hash + "." + extension(url);
  }

  static String extension(String url) {
    String path;
    try {
      path = URI.create(url).getPath();
    } catch (IllegalArgumentException e) {
      throw ImageCacheException.unusableUrl("Invalid image URL: " + url);
    }
    Matcher m = EXTENSION.matcher(path == null ? "" : path);
    if (!m.find()) {
      throw ImageCacheException.unusableUrl("Unable to determine file extension from URL: " + url);
    }
    String ext = m.group(1).toLowerCase(Locale.ROOT);
    if (!EXTENSIONS.contains(ext)) {
      throw ImageCacheException.unusableUrl("Unsupported file extension: " + ext);
    }
    return ext;
  }

  /** Candidate download URLs: every known gateway for IPFS content, else the URL itself. */
  static List<String> downloadCandidates(String url) {
    for (Pattern p : IPFS_URL_PATTERNS) {
      Matcher m = p.matcher(url);
      if (m.find()) {
        List<String> out = new ArrayList<>();
        for (String gateway : IPFS_GATEWAYS) out.add(gateway + "/ipfs/" + m.group(1));
        return out;
      }
    }
    return List.of(url);
  }

  private Download download(String url) {
    List<String> errors = new ArrayList<>();
    for (String candidate : downloadCandidates(url)) {
      Download d;
      try {
        d = fetch(candidate);
      } catch (RuntimeException e) {
        errors.add(candidate + ": " + e.getMessage());
        continue;
      }
      if (d == null || d.status() < 200 || d.status() >= 300) {
        errors.add(candidate + ": HTTP " + (d == null ? "none" : d.status()));
        continue;
      }
      if (d.contentType() == null || d.contentType().isBlank()) {
        metrics.imageCached("error");
        throw ImageCacheException.upstream("Response missing content-type for " + candidate, null);
      }
      if (d.bytes() == null || d.bytes().length == 0) {
        errors.add(candidate + ": empty body");
        continue;
      }
      return d;
    }
    metrics.imageCached("error");
    throw ImageCacheException.upstream(
        "Failed to download image " + url + " (" + String.join(", ", errors) + ")", null);
  }

  private Download fetch(String url) {
    return webClient
        .get()
        .uri(URI.create(url))
        .header(HttpHeaders.USER_AGENT, USER_AGENT)
        .header(HttpHeaders.ACCEPT, MediaType.ALL_VALUE)
        .exchangeToMono(
            res -> {
              int status = res.statusCode().value();
              if (!res.statusCode().is2xxSuccessful()) {
                return res.releaseBody().then(Mono.just(new Download(status, null, null)));
              }
              String contentType =
                  res.headers().contentType().map(MediaType::toString).orElse(null);
              return res.bodyToMono(byte[].class)
                  .defaultIfEmpty(new byte[0])
                  .map(bytes -> new Download(status, bytes, contentType));
            })
        .timeout(downloadTimeout)
        .block();
  }

  private record Download(int status, byte[] bytes, String contentType) {}
}
