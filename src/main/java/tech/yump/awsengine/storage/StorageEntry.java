package tech.yump.awsengine.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Base64;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The unit persisted by a {@link StorageBackend}: an opaque value stored under a logical key.
 * Serialized to/from JSON by backends that write to disk.
 *
 * <pre>
 * {
 *   "v": 1,
 *   "k": "config/root",
 *   "d": "BASE64_ENCODED_VALUE",
 *   "ts": 1678886400
 * }
 * </pre>
 */
@Data
@NoArgsConstructor // Needed for Jackson deserialization
@AllArgsConstructor
public class StorageEntry {

  /**
   * Version number of this storage format. Starts at 1.
   */
  @JsonProperty("v")
  private int version = 1;

  @JsonProperty("k")
  private String key;

  /**
   * The stored value, encoded as a Base64 String.
   */
  @JsonProperty("d")
  private String valueBase64;

  /**
   * When the entry was written.
   */
  @JsonProperty("ts")
  private Instant timestamp;

  /**
   * Creates an entry for the given key from raw value bytes. Sets the timestamp to now.
   *
   * @param key   Logical key, must not be null.
   * @param value Raw value bytes, must not be null.
   */
  public StorageEntry(String key, byte[] value) {
    if (key == null || value == null) {
      throw new IllegalArgumentException("Key and value cannot be null.");
    }
    this.version = 1;
    this.key = key;
    this.valueBase64 = Base64.getEncoder().encodeToString(value);
    this.timestamp = Instant.now();
  }

  /**
   * Decodes the Base64 value back into raw bytes.
   *
   * @throws IllegalStateException if no value is set.
   */
  public byte[] valueBytes() {
    if (this.valueBase64 == null) {
      throw new IllegalStateException("Value Base64 string is null.");
    }
    return Base64.getDecoder().decode(this.valueBase64);
  }
}
