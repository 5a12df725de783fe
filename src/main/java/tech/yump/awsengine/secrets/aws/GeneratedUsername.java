package tech.yump.awsengine.secrets.aws;

import tech.yump.awsengine.secrets.aws.naming.CredentialType;
import tech.yump.awsengine.secrets.aws.naming.PrincipalType;

/**
 * A username issued for a credential request.
 */
public record GeneratedUsername(
        String username,
        CredentialType credentialType,
        PrincipalType principalType
) {}
