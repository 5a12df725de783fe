package tech.yump.awsengine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import tech.yump.awsengine.audit.AuditBackend;
import tech.yump.awsengine.audit.LogAuditBackend;
import tech.yump.awsengine.secrets.aws.AwsSecretsEngine;
import tech.yump.awsengine.storage.InMemoryStorageBackend;
import tech.yump.awsengine.storage.StorageBackend;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@DisplayName("Integration Test: SLF4j Audit Backend (Default)")
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
public class Slf4jAuditBackendIntegrationTest {

    @Autowired
    private AuditBackend auditBackend;
    @Autowired
    private StorageBackend storageBackend;
    @Autowired
    private AwsSecretsEngine awsSecretsEngine;

    @Test
    void shouldUseSlf4jAuditBackendAndInMemoryStorage() {
        assertThat(auditBackend)
                .withFailMessage("Expected LogAuditBackend bean as the default")
                .isInstanceOf(LogAuditBackend.class);
        assertThat(storageBackend).isInstanceOf(InMemoryStorageBackend.class);
    }

    @Test
    void usernameGenerationIsAuditedWithoutSecrets(CapturedOutput output) {
        String username = awsSecretsEngine.generateUsername("audit-app", "audit-policy", "iam_user").username();

        assertThat(output.getOut())
                .contains("AUDIT_EVENT:")
                .contains("\"type\":\"aws_operation\"")
                .contains("\"action\":\"generate_username\"")
                .contains(username);
    }
}
