package notestore.media;

/**
 * Image re-encoding settings.
 *
 * @param maxWidth maximum stored width in pixels; wider images are downscaled keeping
 *                 their aspect ratio
 * @param quality  JPEG quality between 0 (smallest) and 1 (best)
 */
public record MediaOptions(int maxWidth, double quality) {
  public static final int DEFAULT_MAX_WIDTH = 1920;
  public static final double DEFAULT_QUALITY = 0.8;

  public MediaOptions {
    if (maxWidth <= 0) {
      throw new IllegalArgumentException("maxWidth must be > 0");
    }
    if (quality < 0 || quality > 1) {
      throw new IllegalArgumentException("quality must be between 0 and 1");
    }
  }

  public static MediaOptions defaults() {
    return new MediaOptions(DEFAULT_MAX_WIDTH, DEFAULT_QUALITY);
  }
}
