package tech.yump.awsengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.awsengine.secrets.aws.GeneratedUsername;

@Schema(description = "Generated principal name.")
public record UsernameResponse(
        @Schema(description = "The generated name.", example = "vault-token-alice-readonly-1700000000-Xq3rT9aLmZ0bKp2WcV7e", requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("username")
        String username,

        @Schema(description = "Credential type the name was generated for.", example = "iam_user", requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("credential_type")
        String credentialType,

        @Schema(description = "Principal type, which decides the length limit (IAM: 64, STS: 32).", example = "IAM", requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("principal_type")
        String principalType
) {

    public static UsernameResponse from(GeneratedUsername generated) {
        return new UsernameResponse(
                generated.username(),
                generated.credentialType().wireName(),
                generated.principalType().label());
    }
}
