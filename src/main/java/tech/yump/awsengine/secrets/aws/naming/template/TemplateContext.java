package tech.yump.awsengine.secrets.aws.naming.template;

import tech.yump.awsengine.secrets.aws.naming.PrincipalType;

/**
 * The fields a username template can reference. Built per generation call and never shared.
 * Lookup is a closed switch: only {@code .DisplayName}, {@code .PolicyName} and {@code .Type} exist.
 */
public record TemplateContext(
        String displayName,
        String policyName,
        PrincipalType type
) {

    public TemplateContext {
        if (type == null) {
            throw new IllegalArgumentException("Principal type cannot be null.");
        }
        displayName = displayName == null ? "" : displayName;
        policyName = policyName == null ? "" : policyName;
    }

    /**
     * @param name field name without the leading dot
     * @throws TemplateRenderException if no such field exists
     */
    public Object field(String name) {
        return switch (name) {
            case "DisplayName" -> displayName;
            case "PolicyName" -> policyName;
            case "Type" -> type.label();
            default -> throw new TemplateRenderException("can't evaluate field " + name + " in username template context");
        };
    }
}
