package tech.yump.awsengine.secrets.aws.naming.template;

import tech.yump.awsengine.secrets.SecretsEngineException;

/**
 * Raised when a username template cannot be parsed or rendered: malformed syntax, an undefined
 * field or function, or a function called with unusable arguments.
 */
public class TemplateRenderException extends SecretsEngineException {
    public TemplateRenderException(String message) {
        super(message);
    }

    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
