package tech.yump.awsengine.secrets.aws.naming;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Credential types a caller can request, keyed by their wire name, and the principal type
 * each one is named as. The table is fixed.
 */
public enum CredentialType {
    IAM_USER("iam_user", PrincipalType.IAM),
    ASSUME_ROLE("assume_role", PrincipalType.IAM),
    ASSUMED_ROLE("assumed_role", PrincipalType.IAM),
    STS("sts", PrincipalType.STS),
    FEDERATION_TOKEN("federation_token", PrincipalType.STS),
    SESSION_TOKEN("session_token", PrincipalType.STS);

    private final String wireName;
    private final PrincipalType principalType;

    CredentialType(String wireName, PrincipalType principalType) {
        this.wireName = wireName;
        this.principalType = principalType;
    }

    public String wireName() {
        return wireName;
    }

    public PrincipalType principalType() {
        return principalType;
    }

    /**
     * Resolves a credential type from its wire name (e.g. "iam_user").
     *
     * @throws IllegalArgumentException if the name is null or not a known credential type.
     */
    public static CredentialType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported credential type '" + wireName + "'. Expected one of: "
                                + Arrays.stream(values()).map(CredentialType::wireName).collect(Collectors.joining(", "))));
    }
}
