package io.statusmvp.tokenbalances.controller;

import static org.mockito.BDDMockito.given;

import io.statusmvp.tokenbalances.error.ImageCacheException;
import io.statusmvp.tokenbalances.service.ImageCacheService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

@WebFluxTest(controllers = ImageCacheController.class)
class ImageCacheControllerTest {
  @Autowired private WebTestClient webTestClient;

  @MockBean private ImageCacheService images;

  private WebTestClient.ResponseSpec cache(String url) {
    return webTestClient
        .get()
        .uri(b -> b.path("/api/v1/cache-image").queryParam("url", url).build())
        .exchange();
  }

  @Test
  void returnsHostedUrl() {
    given(images.cache("https://example.com/logo.png"))
        .willReturn("https://cdn.blob.example/token-images/abc.png");

    cache("https://example.com/logo.png")
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.cachedUrl")
        .isEqualTo("https://cdn.blob.example/token-images/abc.png");
  }

  @Test
  void unusableUrlIsBadRequest() {
    given(images.cache("https://example.com/logo"))
        .willThrow(ImageCacheException.unusableUrl("Unable to determine file extension"));

    cache("https://example.com/logo").expectStatus().isBadRequest();
  }

  @Test
  void unconfiguredStoreIsServiceUnavailable() {
    given(images.cache("https://example.com/logo.png")).willThrow(ImageCacheException.notConfigured());

    cache("https://example.com/logo.png")
        .expectStatus()
        .isEqualTo(503)
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("Blob storage is not configured");
  }
}
