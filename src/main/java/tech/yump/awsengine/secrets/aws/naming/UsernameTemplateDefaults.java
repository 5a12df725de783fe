package tech.yump.awsengine.secrets.aws.naming;

import org.springframework.util.StringUtils;

/**
 * The template stored when a configuration write leaves {@code username_template} empty, and
 * used for generation when no configuration has been written yet.
 *
 * @param usernameTemplate the default template text, never blank
 */
public record UsernameTemplateDefaults(String usernameTemplate) {

    /**
     * STS names carry only the timestamp and a random suffix; IAM names also embed the display
     * and policy names. Each branch is cut to its type's limit.
     */
    public static final String BUILT_IN_USERNAME_TEMPLATE =
            "{{ if (eq .Type \"STS\") }}\n"
                    + "  {{ printf \"vault-%s-%s\" (unix_time) (random 20) | truncate 32 }}\n"
                    + "{{ else }}\n"
                    + "  {{ printf \"vault-%s-%s-%s\" (printf \"%s-%s\" (.DisplayName) (.PolicyName) | truncate 42) (unix_time) (random 20) | truncate 64 }}\n"
                    + "{{ end }}";

    public UsernameTemplateDefaults {
        if (!StringUtils.hasText(usernameTemplate)) {
            throw new IllegalArgumentException("Default username template cannot be blank.");
        }
    }

    public static UsernameTemplateDefaults builtIn() {
        return new UsernameTemplateDefaults(BUILT_IN_USERNAME_TEMPLATE);
    }
}
