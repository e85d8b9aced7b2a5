package io.statusmvp.tokenbalances.controller;

import io.statusmvp.tokenbalances.model.CachedImageResponse;
import io.statusmvp.tokenbalances.service.ImageCacheService;
import jakarta.validation.constraints.NotBlank;
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
public class ImageCacheController {
  private final ImageCacheService images;

  public ImageCacheController(ImageCacheService images) {
    this.images = images;
  }

  @GetMapping("/cache-image")
  public Mono<CachedImageResponse> cacheImage(@RequestParam("url") @NotBlank String url) {
    return Mono.fromCallable(() -> new CachedImageResponse(images.cache(url)))
        .subscribeOn(Schedulers.boundedElastic());
  }
}
