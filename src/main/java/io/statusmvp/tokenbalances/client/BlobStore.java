package io.statusmvp.tokenbalances.client;

import java.util.Optional;

/** Durable public storage for re-hosted images. */
public interface BlobStore {
  boolean isEnabled();

  /** True when {@code url} already points into this store. */
  boolean isHosted(String url);

  /** Public URL of the object at {@code path}, or empty when it does not exist. */
  Optional<String> head(String path);

  /** Stores the bytes (overwriting) and returns their public URL. */
  String put(String path, byte[] bytes, String contentType);
}
