package notestore.model;

import java.time.Instant;

/**
 * A stored binary object with its metadata.
 *
 * @see notestore.spi.BlobStore#getRecord
 */
public record BlobRecord(
    String key,
    byte[] data,
    String mimeType,
    long size,
    Instant createdAt
) {}
