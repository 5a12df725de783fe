package tech.yump.awsengine.secrets.aws.naming;

/**
 * Category of cloud identity being named. Drives the {@code .Type} template value and the
 * maximum length of the generated name.
 */
public enum PrincipalType {
    IAM("IAM", 64),
    STS("STS", 32);

    private final String label;
    private final int maxLength;

    PrincipalType(String label, int maxLength) {
        this.label = label;
        this.maxLength = maxLength;
    }

    /**
     * @return the value exposed to templates as {@code .Type}.
     */
    public String label() {
        return label;
    }

    public int maxLength() {
        return maxLength;
    }
}
