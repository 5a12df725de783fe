package tech.yump.awsengine.secrets.aws;

import tech.yump.awsengine.secrets.SecretsEngineException;
import tech.yump.awsengine.secrets.aws.naming.UsernameLengthExceededException;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateRenderException;
import tech.yump.awsengine.storage.StorageException;

/**
 * Naming side of the AWS secrets engine: root configuration management and generation of
 * principal names for IAM users, assumed roles and STS sessions.
 */
public interface AwsSecretsEngine {

    /**
     * Creates or replaces the root configuration. An empty username template is replaced by
     * the default template before it is stored.
     *
     * @throws StorageException If the configuration cannot be persisted.
     */
    void writeRootConfig(RootConfig config) throws StorageException;

    /**
     * Returns the stored root configuration exactly as written.
     *
     * @throws ConfigNotFoundException If no configuration has been written.
     * @throws StorageException        If the configuration cannot be read.
     */
    RootConfig readRootConfig() throws ConfigNotFoundException, StorageException;

    /**
     * Generates a principal name using the configured template (or the default template when
     * nothing is configured). Display and policy names are normalized before rendering.
     *
     * @param displayName    Caller display name, may contain any characters.
     * @param policyName     Policy or role name the credential is issued for.
     * @param credentialType Wire name of the credential type (e.g. "iam_user", "sts").
     * @throws IllegalArgumentException        If the credential type is unknown.
     * @throws TemplateRenderException         If the template cannot be rendered.
     * @throws UsernameLengthExceededException If the rendered name exceeds the type's limit.
     * @throws SecretsEngineException          For other engine failures.
     */
    GeneratedUsername generateUsername(String displayName, String policyName, String credentialType)
            throws SecretsEngineException;
}
