package tech.yump.awsengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import tech.yump.awsengine.secrets.aws.RootConfig;

@Schema(description = "Root configuration of the AWS secrets engine.")
public record RootConfigRequest(
        @Schema(description = "Connection URI, passed through unchanged.", example = "https://iam.amazonaws.com", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "connection_uri must be provided.")
        @JsonProperty("connection_uri")
        String connectionUri,

        @Schema(description = "Username used to connect, passed through unchanged.", example = "admin", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "username must be provided.")
        @JsonProperty("username")
        String username,

        @Schema(description = "Password used to connect, passed through unchanged.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "password must be provided.")
        @JsonProperty("password")
        String password,

        @Schema(description = "Template for generated usernames. When empty or omitted the default template is stored.",
                example = "{{ printf \"vault-%s-%s\" (unix_time) (random 10) }}")
        @JsonProperty("username_template")
        String usernameTemplate
) {

    public RootConfig toRootConfig() {
        return new RootConfig(connectionUri, username, password, usernameTemplate);
    }

    @Override
    public String toString() {
        return "RootConfigRequest[connectionUri='" + connectionUri + "', username='" + username
                + "', password=******, usernameTemplate='" + usernameTemplate + "']";
    }
}
