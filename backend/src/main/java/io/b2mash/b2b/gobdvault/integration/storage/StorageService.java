package io.b2mash.b2b.gobdvault.integration.storage;

/**
 * Abstraction for object storage operations. Domain services inject this interface instead of
 * vendor-specific clients (e.g., S3Client). Objects are write-once: a key that already holds an
 * object cannot be overwritten.
 *
 * <p>System-wide: selected via @ConditionalOnProperty {@code storage.provider}, not per-tenant.
 */
public interface StorageService {

  /**
   * Stores {@code content} under {@code key} and returns the key.
   *
   * @throws io.b2mash.b2b.gobdvault.exception.ResourceConflictException if the key is taken
   * @throws io.b2mash.b2b.gobdvault.exception.StorageUnavailableException on I/O failure
   */
  String upload(String key, byte[] content, String contentType);

  /**
   * Downloads an object's content as bytes.
   *
   * @throws io.b2mash.b2b.gobdvault.exception.ResourceNotFoundException if no object exists
   * @throws io.b2mash.b2b.gobdvault.exception.StorageUnavailableException on I/O failure
   */
  byte[] download(String key);

  boolean exists(String key);

  /** Delete an object. Best-effort: returns false and logs a warning on failure. */
  boolean delete(String key);
}
