package tech.yump.awsengine.secrets.aws;

import tech.yump.awsengine.secrets.SecretsEngineException;

/**
 * Thrown when the engine's root configuration has never been written.
 */
public class ConfigNotFoundException extends SecretsEngineException {
    public ConfigNotFoundException(String key) {
        super("No configuration found at '" + key + "'");
    }
}
