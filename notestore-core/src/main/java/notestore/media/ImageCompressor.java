package notestore.media;

import notestore.ValidationException;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;

/**
 * Downscales and re-encodes images as JPEG.
 *
 * <p>Any format readable by {@link ImageIO} is accepted. Transparent areas are flattened
 * onto white. The original dimensions are not kept anywhere.
 */
public final class ImageCompressor {
  public static final String OUTPUT_MIME_TYPE = "image/jpeg";

  /**
   * Re-encodes an image so that its width does not exceed {@code options.maxWidth()}.
   *
   * @throws ValidationException if the bytes are not a readable image
   */
  public byte[] compress(byte[] image, MediaOptions options) {
    BufferedImage source = decode(image);
    int width = source.getWidth();
    int height = source.getHeight();
    if (width > options.maxWidth()) {
      height = Math.max(1, (int) Math.round(height * (options.maxWidth() / (double) width)));
      width = options.maxWidth();
    }

    BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = target.createGraphics();
    try {
      graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
          RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      graphics.drawImage(source, 0, 0, width, height, Color.WHITE, null);
    } finally {
      graphics.dispose();
    }
    return encodeJpeg(target, (float) options.quality());
  }

  private static BufferedImage decode(byte[] image) {
    BufferedImage source;
    try {
      source = ImageIO.read(new ByteArrayInputStream(image));
    } catch (IOException e) {
      throw new ValidationException("image", "unreadable image: " + e.getMessage());
    }
    if (source == null) {
      throw new ValidationException("image", "unsupported image format");
    }
    return source;
  }

  private static byte[] encodeJpeg(BufferedImage image, float quality) {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IllegalStateException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    ImageWriteParam param = writer.getDefaultWriteParam();
    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    param.setCompressionQuality(quality);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(stream);
      writer.write(null, new IIOImage(image, null, null), param);
    } catch (IOException e) {
      throw new UncheckedIOException("JPEG encoding failed", e);
    } finally {
      writer.dispose();
    }
    return out.toByteArray();
  }
}
