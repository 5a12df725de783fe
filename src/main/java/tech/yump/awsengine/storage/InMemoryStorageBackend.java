package tech.yump.awsengine.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent backend keeping entries in a map. Contents are lost on restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "awsengine.storage.type", havingValue = "inmem")
public class InMemoryStorageBackend implements StorageBackend {

  private final ConcurrentHashMap<String, StorageEntry> entries = new ConcurrentHashMap<>();

  @Override
  public void put(StorageEntry entry) throws StorageException {
    if (entry == null || !StringUtils.hasText(entry.getKey())) {
      throw new IllegalArgumentException("Entry cannot be null and must carry a non-empty key for put operation.");
    }
    entries.put(entry.getKey(), entry);
    log.debug("Stored entry for key '{}'. Entries held: {}", entry.getKey(), entries.size());
  }

  @Override
  public Optional<StorageEntry> get(String key) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for get operation.");
    }
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public void delete(String key) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for delete operation.");
    }
    if (entries.remove(key) != null) {
      log.debug("Deleted entry for key '{}'", key);
    }
  }
}
