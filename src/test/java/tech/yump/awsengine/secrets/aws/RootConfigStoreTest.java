package tech.yump.awsengine.secrets.aws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.awsengine.secrets.aws.naming.UsernameTemplateDefaults;
import tech.yump.awsengine.storage.InMemoryStorageBackend;
import tech.yump.awsengine.storage.StorageBackend;
import tech.yump.awsengine.storage.StorageEntry;
import tech.yump.awsengine.storage.StorageException;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RootConfigStoreTest {

    @Mock
    private StorageBackend failingStorage;

    private InMemoryStorageBackend storage;
    private RootConfigStore store;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        storage = new InMemoryStorageBackend();
        store = new RootConfigStore(objectMapper, UsernameTemplateDefaults.builtIn());
    }

    @Test
    @DisplayName("write: empty template is replaced by the default before storing")
    void write_emptyTemplate_storesDefault() {
        store.write(storage, new RootConfig("https://iam.amazonaws.com", "admin", "secret", ""));

        RootConfig read = store.read(storage);
        assertThat(read.usernameTemplate()).isEqualTo(UsernameTemplateDefaults.BUILT_IN_USERNAME_TEMPLATE);
        assertThat(read.connectionUri()).isEqualTo("https://iam.amazonaws.com");
        assertThat(read.username()).isEqualTo("admin");
        assertThat(read.password()).isEqualTo("secret");
    }

    @Test
    @DisplayName("write: missing template is replaced by the default before storing")
    void write_nullTemplate_storesDefault() {
        store.write(storage, new RootConfig("uri", "admin", "secret", null));

        assertThat(store.read(storage).usernameTemplate())
                .isEqualTo(UsernameTemplateDefaults.BUILT_IN_USERNAME_TEMPLATE);
    }

    @Test
    @DisplayName("write/read: custom template round-trips byte-for-byte")
    void write_customTemplate_roundTripsExactly() {
        String template = "`foo-{{ .DisplayName }}`";
        store.write(storage, new RootConfig("uri", "admin", "secret", template));

        assertThat(store.read(storage).usernameTemplate()).isEqualTo(template);
    }

    @Test
    @DisplayName("write: whitespace-only template is stored as given")
    void write_whitespaceTemplate_isKept() {
        store.write(storage, new RootConfig("uri", "admin", "secret", "  "));

        assertThat(store.read(storage).usernameTemplate()).isEqualTo("  ");
    }

    @Test
    @DisplayName("write: the configured default replaces the built-in one")
    void write_configuredDefault() {
        RootConfigStore customStore = new RootConfigStore(new ObjectMapper(), new UsernameTemplateDefaults("{{ .Type }}"));
        customStore.write(storage, new RootConfig("uri", "admin", "secret", ""));

        assertThat(customStore.read(storage).usernameTemplate()).isEqualTo("{{ .Type }}");
    }

    @Test
    @DisplayName("write: a second write replaces the first")
    void write_overwrites() {
        store.write(storage, new RootConfig("uri-1", "admin", "secret", "a"));
        store.write(storage, new RootConfig("uri-2", "admin", "secret", "b"));

        RootConfig read = store.read(storage);
        assertThat(read.connectionUri()).isEqualTo("uri-2");
        assertThat(read.usernameTemplate()).isEqualTo("b");
    }

    @Test
    @DisplayName("write: null configuration is rejected")
    void write_null_throws() {
        assertThatThrownBy(() -> store.write(storage, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("read: nothing stored raises ConfigNotFoundException")
    void read_missing_throws() {
        assertThatThrownBy(() -> store.read(storage))
                .isInstanceOf(ConfigNotFoundException.class)
                .hasMessage("No configuration found at 'config/root'");
    }

    @Test
    @DisplayName("read: corrupt stored value raises StorageException")
    void read_corrupt_throws() {
        storage.put(new StorageEntry(RootConfigStore.ROOT_CONFIG_KEY, "not json".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> store.read(storage))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("Failed to parse root configuration");
    }

    @Test
    @DisplayName("Backend errors propagate unchanged")
    void backendErrors_propagate() {
        StorageException readFailure = new StorageException("disk gone");
        when(failingStorage.get(RootConfigStore.ROOT_CONFIG_KEY)).thenThrow(readFailure);
        StorageException writeFailure = new StorageException("disk full");
        doThrow(writeFailure).when(failingStorage).put(any(StorageEntry.class));

        assertThatThrownBy(() -> store.read(failingStorage)).isSameAs(readFailure);
        assertThatThrownBy(() -> store.write(failingStorage, new RootConfig("uri", "u", "p", "t")))
                .isSameAs(writeFailure);
    }

    @Test
    @DisplayName("read: uses the fixed storage key")
    void read_usesFixedKey() {
        when(failingStorage.get("config/root")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.read(failingStorage)).isInstanceOf(ConfigNotFoundException.class);
    }
}
