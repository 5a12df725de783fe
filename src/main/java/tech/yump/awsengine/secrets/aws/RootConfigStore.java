package tech.yump.awsengine.secrets.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.awsengine.secrets.aws.naming.UsernameTemplateDefaults;
import tech.yump.awsengine.storage.StorageBackend;
import tech.yump.awsengine.storage.StorageEntry;
import tech.yump.awsengine.storage.StorageException;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads and writes the root configuration of a mount. The storage backend is passed on every
 * call; this class holds no handle to it. Errors raised by the backend propagate unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RootConfigStore {

    public static final String ROOT_CONFIG_KEY = "config/root";

    private final ObjectMapper objectMapper;
    private final UsernameTemplateDefaults usernameTemplateDefaults;

    /**
     * Persists the configuration, storing the default template when {@code username_template}
     * is null or empty.
     *
     * @throws StorageException if the configuration cannot be serialized or the backend fails.
     */
    public void write(StorageBackend storage, RootConfig config) throws StorageException {
        if (config == null) {
            throw new IllegalArgumentException("Root configuration cannot be null.");
        }
        RootConfig toStore = config;
        if (!StringUtils.hasLength(config.usernameTemplate())) {
            log.debug("No username template supplied, storing the default template.");
            toStore = config.withUsernameTemplate(usernameTemplateDefaults.usernameTemplate());
        }

        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(toStore);
        } catch (JsonProcessingException e) {
            log.error("Serialization error writing root configuration: {}", e.getMessage(), e);
            throw new StorageException("Failed to serialize root configuration", e);
        }
        storage.put(new StorageEntry(ROOT_CONFIG_KEY, json));
        log.info("Root configuration written to '{}'", ROOT_CONFIG_KEY);
    }

    /**
     * Loads the configuration exactly as stored.
     *
     * @throws ConfigNotFoundException if no configuration has been written.
     * @throws StorageException        if the stored entry cannot be read or parsed.
     */
    public RootConfig read(StorageBackend storage) throws ConfigNotFoundException, StorageException {
        Optional<StorageEntry> entry = storage.get(ROOT_CONFIG_KEY);
        if (entry.isEmpty()) {
            log.debug("No root configuration stored at '{}'", ROOT_CONFIG_KEY);
            throw new ConfigNotFoundException(ROOT_CONFIG_KEY);
        }
        try {
            return objectMapper.readValue(entry.get().valueBytes(), RootConfig.class);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            // IllegalArgument/IllegalState come from a corrupt Base64 value
            log.error("Failed to parse root configuration at '{}': {}", ROOT_CONFIG_KEY, e.getMessage(), e);
            throw new StorageException("Failed to parse root configuration at: " + ROOT_CONFIG_KEY, e);
        }
    }
}
