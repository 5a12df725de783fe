package tech.yump.awsengine.secrets.aws.naming;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateContext;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateFunctions;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateRenderException;
import tech.yump.awsengine.secrets.aws.naming.template.UsernameTemplate;

/**
 * Renders a username template for a credential request and enforces the length limit of the
 * resulting principal type.
 *
 * <p>Display and policy names are embedded as given; callers normalize untrusted input with
 * {@link DisplayNameNormalizer} first. Stateless, safe for concurrent use.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsernameGenerator {

    private final TemplateFunctions templateFunctions;

    /**
     * @param displayName    value for {@code .DisplayName}
     * @param policyName     value for {@code .PolicyName}
     * @param credentialType requested credential type; selects {@code .Type} and the length limit
     * @param template       template text
     * @return the rendered name, unmodified
     * @throws TemplateRenderException         if the template is malformed or references an undefined field or function
     * @throws UsernameLengthExceededException if the rendered name is too long for the principal type
     */
    public String generate(String displayName, String policyName, CredentialType credentialType, String template) {
        PrincipalType principalType = credentialType.principalType();
        TemplateContext context = new TemplateContext(displayName, policyName, principalType);

        String username = UsernameTemplate.parse(template, templateFunctions).render(context);
        log.debug("Rendered username of length {} for credential type '{}' ({})",
                username.length(), credentialType.wireName(), principalType.label());

        UsernameLengthValidator.validate(username, principalType);
        return username;
    }

    /**
     * Convenience overload resolving the credential type from its wire name (e.g. "iam_user").
     *
     * @throws IllegalArgumentException if the credential type is unknown
     */
    public String generate(String displayName, String policyName, String credentialType, String template) {
        return generate(displayName, policyName, CredentialType.fromWireName(credentialType), template);
    }
}
