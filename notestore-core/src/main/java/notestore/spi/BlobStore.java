package notestore.spi;

import notestore.model.BlobRecord;

import java.util.List;
import java.util.Optional;

/**
 * Key/value storage for binary media, kept apart from structured rows.
 *
 * <p>Entities refer to blobs by key only; the store does not track references, so a blob
 * can outlive the entity that pointed at it. A missing key is reported as an empty
 * {@link Optional}, never as an exception.
 */
public interface BlobStore {

  /**
   * Stores or overwrites a blob.
   *
   * @param key      the key, or {@code null} to generate one
   * @param data     the raw bytes
   * @param mimeType content type, {@code null} for {@code application/octet-stream}
   * @return the key under which the blob was stored
   */
  String store(String key, byte[] data, String mimeType);

  Optional<byte[]> get(String key);

  Optional<BlobRecord> getRecord(String key);

  /**
   * Removes a blob. Deleting a missing key is not an error.
   */
  void delete(String key);

  /**
   * All stored keys in lexical order.
   */
  List<String> keys();

  /**
   * Sum of all stored blob sizes in bytes.
   */
  long totalSize();
}
