package tech.yump.awsengine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the AWS secrets engine under the 'awsengine' prefix.
 */
@ConfigurationProperties(prefix = "awsengine")
@Validated
public record AwsEngineProperties(

        @Valid
        @NotNull(message = "Storage configuration (awsengine.storage) is required.")
        StorageProperties storage,

        @Valid
        NamingProperties naming,

        @Valid
        AuditProperties audit
) {

    public AwsEngineProperties {
        if (naming == null) {
            naming = new NamingProperties(null);
        }
        if (audit == null) {
            audit = new AuditProperties(AuditProperties.SLF4J);
        }
    }

    public enum StorageType {
        FILESYSTEM, INMEM
    }

    // --- StorageProperties ---
    @Validated
    public record StorageProperties(
            StorageType type,

            @Valid
            FileSystemProperties filesystem
    ) {
        public StorageProperties {
            if (type == null) {
                type = StorageType.FILESYSTEM;
            }
        }

        @AssertTrue(message = "Filesystem storage path (awsengine.storage.filesystem.path) must be provided when storage type is 'filesystem'.")
        public boolean isFilesystemConfigValid() {
            return type != StorageType.FILESYSTEM
                    || (filesystem != null && StringUtils.hasText(filesystem.path()));
        }

        @Validated
        public record FileSystemProperties(
                @NotBlank(message = "Filesystem storage path (awsengine.storage.filesystem.path) must not be blank.")
                String path
        ) {}
    }

    /**
     * Naming options. When no default template is configured the built-in one is used.
     */
    @Validated
    public record NamingProperties(
            String defaultUsernameTemplate
    ) {}

    @Validated
    public record AuditProperties(
            @NotBlank(message = "Audit backend (awsengine.audit.backend) must not be blank.")
            String backend
    ) {
        public static final String SLF4J = "slf4j";

        public AuditProperties {
            if (backend == null) {
                backend = SLF4J;
            }
        }

        @AssertTrue(message = "Unsupported audit backend (awsengine.audit.backend). Supported: slf4j.")
        public boolean isBackendSupported() {
            return SLF4J.equalsIgnoreCase(backend);
        }
    }
}
