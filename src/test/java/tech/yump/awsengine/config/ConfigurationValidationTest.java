package tech.yump.awsengine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.awsengine.secrets.aws.naming.UsernameTemplateDefaults;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigurationValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TestConfig.class));

    @EnableConfigurationProperties(AwsEngineProperties.class)
    static class TestConfig {}

    @Test
    @DisplayName("Config Validation: Should FAIL when storage config is missing")
    void validateStorage_missing_shouldFail() {
        contextRunner
                .withPropertyValues("awsengine.audit.backend=slf4j")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Storage configuration (awsengine.storage) is required.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when filesystem storage has no path")
    void validateFilesystemPath_missing_shouldFail() {
        contextRunner
                .withPropertyValues("awsengine.storage.type=filesystem")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Filesystem storage path (awsengine.storage.filesystem.path) must be provided when storage type is 'filesystem'.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should PASS with filesystem storage and a path, applying defaults")
    void validateFilesystem_withPath_shouldPass() {
        contextRunner
                .withPropertyValues("awsengine.storage.filesystem.path=./test-validation-storage")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    AwsEngineProperties props = context.getBean(AwsEngineProperties.class);
                    assertThat(props.storage().type()).isEqualTo(AwsEngineProperties.StorageType.FILESYSTEM);
                    assertThat(props.storage().filesystem().path()).isEqualTo("./test-validation-storage");
                    assertThat(props.naming().defaultUsernameTemplate()).isNull();
                    assertThat(props.audit().backend()).isEqualTo("slf4j");
                });
    }

    @Test
    @DisplayName("Config Validation: Should PASS with in-memory storage and no path")
    void validateInMemory_shouldPass() {
        contextRunner
                .withPropertyValues("awsengine.storage.type=inmem")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    AwsEngineProperties props = context.getBean(AwsEngineProperties.class);
                    assertThat(props.storage().type()).isEqualTo(AwsEngineProperties.StorageType.INMEM);
                    assertThat(props.storage().filesystem()).isNull();
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL for an unsupported audit backend")
    void validateAuditBackend_unsupported_shouldFail() {
        contextRunner
                .withPropertyValues(
                        "awsengine.storage.type=inmem",
                        "awsengine.audit.backend=file"
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Unsupported audit backend (awsengine.audit.backend). Supported: slf4j.");
                });
    }

    @Test
    @DisplayName("Naming: configured default template replaces the built-in one")
    void namingConfiguration_configuredDefault() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(NamingConfiguration.class))
                .withPropertyValues(
                        "awsengine.storage.type=inmem",
                        "awsengine.naming.default-username-template={{ .Type }}-{{ random 8 }}"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(UsernameTemplateDefaults.class).usernameTemplate())
                            .isEqualTo("{{ .Type }}-{{ random 8 }}");
                });
    }

    @Test
    @DisplayName("Naming: without configuration the built-in default template is used")
    void namingConfiguration_builtInDefault() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(NamingConfiguration.class))
                .withPropertyValues("awsengine.storage.type=inmem")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(UsernameTemplateDefaults.class).usernameTemplate())
                            .isEqualTo(UsernameTemplateDefaults.BUILT_IN_USERNAME_TEMPLATE);
                });
    }
}
