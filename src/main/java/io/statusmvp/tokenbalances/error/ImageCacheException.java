package io.statusmvp.tokenbalances.error;

public class ImageCacheException extends ApiException {
  private ImageCacheException(String message, int httpStatus, Throwable cause) {
    super(message, httpStatus, cause);
  }

  public static ImageCacheException unusableUrl(String message) {
    return new ImageCacheException(message, 400, null);
  }

  public static ImageCacheException upstream(String message, Throwable cause) {
    return new ImageCacheException(message, 502, cause);
  }

  public static ImageCacheException notConfigured() {
    return new ImageCacheException("Blob storage is not configured", 503, null);
  }
}
