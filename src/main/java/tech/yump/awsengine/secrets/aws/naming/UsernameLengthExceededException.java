package tech.yump.awsengine.secrets.aws.naming;

import tech.yump.awsengine.secrets.SecretsEngineException;

/**
 * Thrown when a rendered username is longer than its principal type allows.
 */
public class UsernameLengthExceededException extends SecretsEngineException {

    private final PrincipalType principalType;

    public UsernameLengthExceededException(PrincipalType principalType) {
        super("the username generated by the template exceeds the " + principalType.label()
                + " username length limits of " + principalType.maxLength() + " chars");
        this.principalType = principalType;
    }

    public PrincipalType getPrincipalType() {
        return principalType;
    }
}
