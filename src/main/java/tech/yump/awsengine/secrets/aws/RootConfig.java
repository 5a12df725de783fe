package tech.yump.awsengine.secrets.aws;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration of an AWS secrets engine mount, persisted as JSON under
 * {@link RootConfigStore#ROOT_CONFIG_KEY}. Connection fields are passed through untouched;
 * {@code usernameTemplate} drives name generation.
 */
public record RootConfig(
        @JsonProperty("connection_uri")
        String connectionUri,

        @JsonProperty("username")
        String username,

        @JsonProperty("password")
        String password,

        @JsonProperty("username_template")
        String usernameTemplate
) {

    public RootConfig withUsernameTemplate(String template) {
        return new RootConfig(connectionUri, username, password, template);
    }

    @Override
    public String toString() {
        // Avoid logging the password in toString()
        return "RootConfig[" +
                "connectionUri='" + connectionUri + '\'' +
                ", username='" + username + '\'' +
                ", password=******" +
                ", usernameTemplate='" + usernameTemplate + '\'' +
                ']';
    }
}
