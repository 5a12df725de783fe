package tech.yump.awsengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.awsengine.secrets.aws.RootConfig;

@Schema(description = "Stored root configuration. The password is never returned.")
public record RootConfigResponse(
        @Schema(description = "Connection URI as stored.", example = "https://iam.amazonaws.com")
        @JsonProperty("connection_uri")
        String connectionUri,

        @Schema(description = "Username as stored.", example = "admin")
        @JsonProperty("username")
        String username,

        @Schema(description = "Username template exactly as stored.")
        @JsonProperty("username_template")
        String usernameTemplate
) {

    public static RootConfigResponse from(RootConfig config) {
        return new RootConfigResponse(config.connectionUri(), config.username(), config.usernameTemplate());
    }
}
