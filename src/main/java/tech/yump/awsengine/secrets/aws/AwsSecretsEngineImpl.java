package tech.yump.awsengine.secrets.aws;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.awsengine.audit.AuditHelper;
import tech.yump.awsengine.secrets.SecretsEngineException;
import tech.yump.awsengine.secrets.aws.naming.CredentialType;
import tech.yump.awsengine.secrets.aws.naming.DisplayNameNormalizer;
import tech.yump.awsengine.secrets.aws.naming.UsernameGenerator;
import tech.yump.awsengine.secrets.aws.naming.UsernameTemplateDefaults;
import tech.yump.awsengine.storage.StorageBackend;
import tech.yump.awsengine.storage.StorageException;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AwsSecretsEngineImpl implements AwsSecretsEngine {

    private static final String AUDIT_TYPE = "aws_operation";

    private final StorageBackend storageBackend;
    private final RootConfigStore rootConfigStore;
    private final UsernameGenerator usernameGenerator;
    private final UsernameTemplateDefaults usernameTemplateDefaults;
    private final AuditHelper auditHelper;

    @Override
    public void writeRootConfig(RootConfig config) throws StorageException {
        log.info("Writing AWS root configuration");
        try {
            rootConfigStore.write(storageBackend, config);
        } catch (StorageException e) {
            auditHelper.logInternalEvent(AUDIT_TYPE, "write_config", "failure", null,
                    Map.of("reason", "Storage error", "error", String.valueOf(e.getMessage())));
            throw e;
        }
        auditHelper.logInternalEvent(AUDIT_TYPE, "write_config", "success", null,
                Map.of("custom_template", config.usernameTemplate() != null && !config.usernameTemplate().isEmpty()));
    }

    @Override
    public RootConfig readRootConfig() throws ConfigNotFoundException, StorageException {
        log.debug("Reading AWS root configuration");
        RootConfig config;
        try {
            config = rootConfigStore.read(storageBackend);
        } catch (ConfigNotFoundException e) {
            auditHelper.logInternalEvent(AUDIT_TYPE, "read_config", "failure", null,
                    Map.of("reason", "Configuration not found"));
            throw e;
        } catch (StorageException e) {
            auditHelper.logInternalEvent(AUDIT_TYPE, "read_config", "failure", null,
                    Map.of("reason", "Storage error", "error", String.valueOf(e.getMessage())));
            throw e;
        }
        auditHelper.logInternalEvent(AUDIT_TYPE, "read_config", "success", null, null);
        return config;
    }

    @Override
    public GeneratedUsername generateUsername(String displayName, String policyName, String credentialType)
            throws SecretsEngineException {
        CredentialType type = CredentialType.fromWireName(credentialType);

        String normalizedDisplayName = DisplayNameNormalizer.normalize(displayName);
        String normalizedPolicyName = DisplayNameNormalizer.normalize(policyName);

        Map<String, Object> auditData = new HashMap<>();
        auditData.put("credential_type", type.wireName());
        auditData.put("policy_name", normalizedPolicyName);

        String template;
        try {
            template = activeTemplate();
        } catch (StorageException e) {
            log.warn("Could not load the username template for credential type '{}': {}", type.wireName(), e.getMessage());
            auditData.put("reason", "Storage error");
            auditData.put("error", String.valueOf(e.getMessage()));
            auditHelper.logInternalEvent(AUDIT_TYPE, "generate_username", "failure", null, auditData);
            throw e;
        }

        String username;
        try {
            username = usernameGenerator.generate(normalizedDisplayName, normalizedPolicyName, type, template);
        } catch (SecretsEngineException e) {
            log.warn("Username generation failed for credential type '{}': {}", type.wireName(), e.getMessage());
            auditData.put("reason", e.getMessage());
            auditHelper.logInternalEvent(AUDIT_TYPE, "generate_username", "failure", null, auditData);
            throw e;
        }

        auditData.put("username", username);
        auditHelper.logInternalEvent(AUDIT_TYPE, "generate_username", "success", null, auditData);
        log.info("Generated {} username for credential type '{}'", type.principalType().label(), type.wireName());
        return new GeneratedUsername(username, type, type.principalType());
    }

    /**
     * The configured template, or the default when no configuration has been written.
     */
    private String activeTemplate() {
        try {
            return rootConfigStore.read(storageBackend).usernameTemplate();
        } catch (ConfigNotFoundException e) {
            log.debug("No root configuration stored, using the default username template");
            return usernameTemplateDefaults.usernameTemplate();
        }
    }
}
