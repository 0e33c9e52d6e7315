package notestore.media;

import notestore.spi.BlobStore;
import notestore.util.Ids;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores captured audio and images in the {@link BlobStore}.
 *
 * <p>Audio is kept byte for byte. Images are downscaled and re-encoded as JPEG before
 * storage, see {@link ImageCompressor}. Keys are {@code audio_<ULID>} and
 * {@code image_<ULID>}.
 */
public final class MediaStorage {
  private static final Logger logger = Logger.getLogger(MediaStorage.class.getName());

  public static final String AUDIO_KIND = "audio";
  public static final String IMAGE_KIND = "image";
  private static final String DEFAULT_AUDIO_TYPE = "audio/webm";

  private final BlobStore blobStore;
  private final ImageCompressor compressor;
  private final MediaOptions options;

  public MediaStorage(BlobStore blobStore) {
    this(blobStore, new ImageCompressor(), MediaOptions.defaults());
  }

  public MediaStorage(BlobStore blobStore, ImageCompressor compressor, MediaOptions options) {
    this.blobStore = Objects.requireNonNull(blobStore, "blobStore");
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Stores an audio recording unmodified.
   *
   * @param mimeType content type, {@code null} for {@code audio/webm}
   * @return the generated blob key
   */
  public String storeAudio(byte[] audio, String mimeType) {
    Objects.requireNonNull(audio, "audio");
    return blobStore.store(Ids.newBlobKey(AUDIO_KIND), audio,
        mimeType == null ? DEFAULT_AUDIO_TYPE : mimeType);
  }

  /**
   * Stores an image with the default {@link MediaOptions} of this instance.
   */
  public String storeImage(byte[] image) {
    return storeImage(image, options);
  }

  /**
   * Downscales, re-encodes and stores an image.
   *
   * @return the generated blob key
   * @throws notestore.ValidationException if the bytes are not a readable image
   */
  public String storeImage(byte[] image, MediaOptions imageOptions) {
    return storeCompressedImage(image, imageOptions).key();
  }

  /**
   * Like {@link #storeImage(byte[])} but also reports the stored size, which differs from
   * the input after compression.
   */
  public StoredMedia storeCompressedImage(byte[] image) {
    return storeCompressedImage(image, options);
  }

  private StoredMedia storeCompressedImage(byte[] image, MediaOptions imageOptions) {
    Objects.requireNonNull(image, "image");
    byte[] compressed = compressor.compress(image, imageOptions);
    logger.log(Level.FINE, "Compressed image from {0} to {1} bytes",
        new Object[]{image.length, compressed.length});
    String key = blobStore.store(Ids.newBlobKey(IMAGE_KIND), compressed, ImageCompressor.OUTPUT_MIME_TYPE);
    return new StoredMedia(key, compressed.length);
  }

  public Optional<byte[]> getMedia(String key) {
    return blobStore.get(key);
  }

  public void deleteMedia(String key) {
    blobStore.delete(key);
  }

  /**
   * Key and byte size of a stored blob.
   */
  public record StoredMedia(String key, long size) {}
}
