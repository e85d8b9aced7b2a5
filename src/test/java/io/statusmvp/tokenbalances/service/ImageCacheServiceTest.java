package io.statusmvp.tokenbalances.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.statusmvp.tokenbalances.client.BlobStore;
import io.statusmvp.tokenbalances.error.ImageCacheException;
import io.statusmvp.tokenbalances.testsupport.StubExchange;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.util.DigestUtils;

class ImageCacheServiceTest {
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

  private BlobStore blobStore;

  @BeforeEach
  void setUp() {
    blobStore = mock(BlobStore.class);
    when(blobStore.isEnabled()).thenReturn(true);
    when(blobStore.head(anyString())).thenReturn(Optional.empty());
    when(blobStore.put(anyString(), any(), anyString()))
        .thenAnswer(inv -> "https://cdn.blob.example/" + inv.getArgument(0));
  }

  private ImageCacheService service(StubExchange exchange) {
    return new ImageCacheService(
        exchange.webClient(), blobStore, new BalanceMetrics(new SimpleMeterRegistry()), 8000);
  }

  @Test
  void blobPathHashesTheUrlString() {
    assertEquals(
        "token-images/"
            + DigestUtils.md5DigestAsHex("https://example.com/logo.png".getBytes(StandardCharsets.UTF_8))
            + ".png",
        ImageCacheService.blobPath("https://example.com/logo.png"));
    assertEquals("jpeg", ImageCacheService.extension("https://example.com/a/b.JPEG?x=1"));
  }

  @Test
  void urlWithoutImageExtensionIsUnusable() {
    ImageCacheService service = service(new StubExchange(req -> StubExchange.status(HttpStatus.OK)));

    ImageCacheException noExt =
        assertThrows(ImageCacheException.class, () -> service.cache("https://example.com/logo"));
    assertEquals(400, noExt.getHttpStatus());
    assertThrows(ImageCacheException.class, () -> service.cache("https://example.com/logo.bmp"));
  }

  @Test
  void downloadsOnceAndStoresWithContentType() {
    StubExchange exchange =
        new StubExchange(req -> StubExchange.bytes(HttpStatus.OK, "image/png", PNG));
    ImageCacheService service = service(exchange);

    String hosted = service.cache("https://example.com/logo.png");

    String path = ImageCacheService.blobPath("https://example.com/logo.png");
    assertEquals("https://cdn.blob.example/" + path, hosted);
    ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
    verify(blobStore).put(eq(path), bytes.capture(), eq("image/png"));
    assertArrayEquals(PNG, bytes.getValue());
  }

  @Test
  void existingObjectIsReturnedWithoutDownloading() {
    String path = ImageCacheService.blobPath("https://example.com/logo.png");
    when(blobStore.head(path)).thenReturn(Optional.of("https://cdn.blob.example/" + path));
    StubExchange exchange = new StubExchange(req -> StubExchange.status(HttpStatus.OK));

    String hosted = service(exchange).cache("https://example.com/logo.png");

    assertEquals("https://cdn.blob.example/" + path, hosted);
    assertTrue(exchange.requests().isEmpty());
    verify(blobStore, never()).put(anyString(), any(), anyString());
  }

  @Test
  void alreadyHostedUrlPassesThrough() {
    when(blobStore.isHosted("https://cdn.blob.example/token-images/a.png")).thenReturn(true);
    StubExchange exchange = new StubExchange(req -> StubExchange.status(HttpStatus.OK));

    assertEquals(
        "https://cdn.blob.example/token-images/a.png",
        service(exchange).cache("https://cdn.blob.example/token-images/a.png"));
    verify(blobStore, never()).head(anyString());
  }

  @Test
  void ipfsContentFallsThroughGateways() {
    StubExchange exchange =
        new StubExchange(
            req ->
                req.url().getHost().equals("gateway.pinata.cloud")
                    ? StubExchange.bytes(HttpStatus.OK, "image/png", PNG)
                    : StubExchange.status(HttpStatus.GATEWAY_TIMEOUT));

    String hosted = service(exchange).cache("https://ipfs.io/ipfs/QmHash123/logo.png");

    assertTrue(hosted.startsWith("https://cdn.blob.example/token-images/"));
    List<String> hosts = exchange.requests().stream().map(r -> r.url().getHost()).toList();
    assertEquals(List.of("cloudflare-ipfs.com", "dweb.link", "gateway.pinata.cloud"), hosts);
  }

  @Test
  void downloadFailureIsUpstreamErrorForDirectCallsButEmptyForBestEffort() {
    StubExchange exchange = new StubExchange(req -> StubExchange.status(HttpStatus.NOT_FOUND));
    ImageCacheService service = service(exchange);

    ImageCacheException e =
        assertThrows(ImageCacheException.class, () -> service.cache("https://example.com/logo.png"));
    assertEquals(502, e.getHttpStatus());
    assertEquals(Optional.empty(), service.cacheBestEffort("https://example.com/logo.png"));
    assertEquals(Optional.empty(), service.cacheBestEffort("https://example.com/no-extension"));
  }

  @Test
  void missingContentTypeIsRejected() {
    StubExchange exchange = new StubExchange(req -> StubExchange.bytes(HttpStatus.OK, null, PNG));

    assertThrows(
        ImageCacheException.class, () -> service(exchange).cache("https://example.com/logo.png"));
    verify(blobStore, never()).put(anyString(), any(), anyString());
  }

  @Test
  void unconfiguredBlobStoreIsServiceUnavailable() {
    when(blobStore.isEnabled()).thenReturn(false);
    ImageCacheService service = service(new StubExchange(req -> StubExchange.status(HttpStatus.OK)));

    ImageCacheException e =
        assertThrows(ImageCacheException.class, () -> service.cache("https://example.com/logo.png"));
    assertEquals(503, e.getHttpStatus());
  }
}
