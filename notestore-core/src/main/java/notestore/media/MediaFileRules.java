package notestore.media;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * Size and type limits for media files accepted from capture adapters.
 *
 * @param maxSizeBytes largest accepted file
 * @param allowedTypes accepted MIME types; empty accepts any type
 */
public record MediaFileRules(long maxSizeBytes, Set<String> allowedTypes) {
  public static final MediaFileRules AUDIO = new MediaFileRules(50L * 1024 * 1024,
      Set.of("audio/mpeg", "audio/wav", "audio/mp4", "audio/webm"));
  public static final MediaFileRules IMAGE = new MediaFileRules(10L * 1024 * 1024,
      Set.of("image/jpeg", "image/png", "image/webp"));

  private static final String[] UNITS = {"Bytes", "KB", "MB", "GB"};

  public MediaFileRules {
    allowedTypes = Set.copyOf(allowedTypes);
  }

  /**
   * Result of {@link #validate}. {@code error} is {@code null} when valid.
   */
  public record Result(boolean valid, String error) {
    static final Result OK = new Result(true, null);
  }

  public Result validate(long sizeBytes, String mimeType) {
    if (sizeBytes > maxSizeBytes) {
      return new Result(false, "File size exceeds " + formatFileSize(maxSizeBytes) + " limit");
    }
    if (!allowedTypes.isEmpty() && (mimeType == null || !allowedTypes.contains(mimeType))) {
      return new Result(false, "File type " + mimeType + " not allowed");
    }
    return Result.OK;
  }

  /**
   * Human readable size with binary units and at most two decimals, e.g. {@code 1.5 KB}.
   */
  public static String formatFileSize(long bytes) {
    if (bytes <= 0) {
      return "0 Bytes";
    }
    int unit = Math.min(UNITS.length - 1, (int) (Math.log(bytes) / Math.log(1024)));
    BigDecimal scaled = BigDecimal.valueOf(bytes)
        .divide(BigDecimal.valueOf(1024).pow(unit), 2, RoundingMode.HALF_UP)
        .stripTrailingZeros();
    return scaled.toPlainString() + " " + UNITS[unit];
  }
}
