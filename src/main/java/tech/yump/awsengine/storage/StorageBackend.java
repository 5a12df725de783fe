package tech.yump.awsengine.storage;

import java.util.Optional;

/**
 * Interface defining the contract for persistent storage backends.
 * Implementations handle the physical storage and retrieval of opaque entries; atomicity of
 * concurrent writes to the same key is whatever the implementation provides.
 */
public interface StorageBackend {

  /**
   * Persists the entry under its key.
   * If data already exists for the key, it is overwritten.
   *
   * @param entry The entry to store. Must not be null and must carry a non-empty key.
   * @throws StorageException If an error occurs during persistence (e.g., I/O error, serialization error).
   */
  void put(StorageEntry entry) throws StorageException;

  /**
   * Retrieves the entry stored under the given key.
   *
   * @param key The unique logical key identifying the data (e.g., "config/root"). Must not be null or empty.
   * @return An Optional containing the entry if found, otherwise Optional.empty().
   * @throws StorageException If an error occurs during retrieval (e.g., I/O error, deserialization error).
   */
  Optional<StorageEntry> get(String key) throws StorageException;

  /**
   * Deletes the entry stored under the given key.
   * If the key does not exist, this method does nothing.
   *
   * @param key The unique logical key identifying the data to delete. Must not be null or empty.
   * @throws StorageException If an error occurs during deletion (e.g., I/O error).
   */
  void delete(String key) throws StorageException;
}
