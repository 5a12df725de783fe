package tech.yump.awsengine.secrets.aws.naming;

/**
 * Length check applied to every rendered username. Names are never shortened here.
 */
public final class UsernameLengthValidator {

    private UsernameLengthValidator() {
    }

    /**
     * @throws UsernameLengthExceededException if {@code name} is longer than {@code principalType.maxLength()}
     */
    public static void validate(String name, PrincipalType principalType) {
        if (name.length() > principalType.maxLength()) {
            throw new UsernameLengthExceededException(principalType);
        }
    }
}
