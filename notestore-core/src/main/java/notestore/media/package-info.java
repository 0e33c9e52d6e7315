/**
 * Media handling on top of the blob store: audio storage, image downscaling and
 * re-encoding, and upload limits.
 */
package notestore.media;
