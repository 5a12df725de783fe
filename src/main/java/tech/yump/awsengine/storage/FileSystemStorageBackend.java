package tech.yump.awsengine.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.awsengine.config.AwsEngineProperties;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Stores each entry as a JSON file named after its key, below a configured base directory.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "awsengine.storage.type", havingValue = "filesystem", matchIfMissing = true)
public class FileSystemStorageBackend implements StorageBackend {

  private final Path basePath;
  private final ObjectMapper objectMapper;

  public FileSystemStorageBackend(
          final ObjectMapper objectMapper,
          final AwsEngineProperties properties
  ) {
    this.objectMapper = objectMapper;
    this.basePath = Paths.get(properties.storage().filesystem().path())
            .toAbsolutePath()
            .normalize();
    log.info("FileSystemStorageBackend initialized with base path: {}", this.basePath);
  }

  /**
   * Validates the base path after bean creation and property injection.
   */
  @PostConstruct
  void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new StorageException("Configured base path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new StorageException("Configured base path directory lacks read/write permissions: " + basePath);
        }
        log.debug("Base path validation successful: {}", basePath);
      } else {
        log.warn("Base path directory does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created base path directory: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create base path: {}", basePath, e);
      throw new StorageException("Failed to initialize storage base path: " + basePath, e);
    }
  }

  @Override
  public void put(StorageEntry entry) throws StorageException {
    if (entry == null || !StringUtils.hasText(entry.getKey())) {
      throw new IllegalArgumentException("Entry cannot be null and must carry a non-empty key for put operation.");
    }
    String key = entry.getKey();
    Path filePath = resolveFilePath(key);
    log.debug("Putting entry for key '{}' at path: {}", key, filePath);

    try {
      Files.createDirectories(filePath.getParent());

      // Whole-file overwrite: concurrent writers on one key end up last-writer-wins
      try (OutputStream out = Files.newOutputStream(filePath, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        objectMapper.writeValue(out, entry);
      }
      log.info("Successfully stored entry for key '{}'", key);
    } catch (IOException e) {
      log.error("Failed to put entry for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to write data for key: " + key, e);
    }
  }

  @Override
  public Optional<StorageEntry> get(String key) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for get operation.");
    }
    Path filePath = resolveFilePath(key);
    log.debug("Getting entry for key '{}' from path: {}", key, filePath);

    if (!Files.isRegularFile(filePath)) {
      log.debug("Entry not found for key '{}' (path {} does not exist or is not a file)", key, filePath);
      return Optional.empty();
    }

    try (InputStream in = Files.newInputStream(filePath, StandardOpenOption.READ)) {
      StorageEntry entry = objectMapper.readValue(in, StorageEntry.class);
      log.debug("Successfully retrieved entry for key '{}'", key);
      return Optional.of(entry);
    } catch (NoSuchFileException e) {
      // Removed between the existence check and the read
      log.warn("Entry not found for key '{}' during read attempt (NoSuchFileException): {}", key, filePath);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to get entry for key '{}' from path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to read or parse data for key: " + key, e);
    }
  }

  @Override
  public void delete(String key) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for delete operation.");
    }
    Path filePath = resolveFilePath(key);
    log.debug("Deleting entry for key '{}' at path: {}", key, filePath);

    try {
      boolean deleted = Files.deleteIfExists(filePath);
      if (deleted) {
        log.info("Successfully deleted entry for key '{}'", key);
      } else {
        log.debug("No entry found to delete for key '{}' (path {} did not exist)", key, filePath);
      }
    } catch (AccessDeniedException e) {
      log.error("Permission denied while trying to delete file for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Permission denied deleting data for key: " + key, e);
    } catch (IOException e) {
      log.error("Failed to delete entry for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to delete data for key: " + key, e);
    }
  }

  /**
   * Resolves the logical key to an absolute ".json" file path within the base directory.
   *
   * @param key The logical key.
   * @return The absolute Path object for the file.
   * @throws StorageException if the key is invalid or resolves outside the base directory.
   */
  private Path resolveFilePath(String key) throws StorageException {
    String sanitizedKey = key.replace('\\', '/').trim();
    if (sanitizedKey.startsWith("/") || sanitizedKey.endsWith("/") || sanitizedKey.contains("..") || sanitizedKey.isEmpty()) {
      log.error("Invalid storage key provided: '{}'", key);
      throw new StorageException("Invalid storage key format: " + key);
    }

    Path absolutePath = this.basePath.resolve(sanitizedKey + ".json").normalize();

    if (!absolutePath.startsWith(this.basePath)) {
      log.error("Path traversal attempt detected for key '{}', resolved path '{}' is outside base path '{}'", key, absolutePath, this.basePath);
      throw new StorageException("Invalid key resulting in path traversal attempt: " + key);
    }

    return absolutePath;
  }
}
