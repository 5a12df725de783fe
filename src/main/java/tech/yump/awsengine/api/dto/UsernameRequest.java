package tech.yump.awsengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Request for a principal name.")
public record UsernameRequest(
        @Schema(description = "Display name of the caller. Characters outside [A-Za-z0-9-_,.@] are replaced by '_'.", example = "token-alice")
        @JsonProperty("display_name")
        String displayName,

        @Schema(description = "Policy or role the credential is issued for; normalized like the display name.", example = "readonly")
        @JsonProperty("policy_name")
        String policyName,

        @Schema(description = "Credential type.", example = "iam_user",
                allowableValues = {"iam_user", "assume_role", "assumed_role", "sts", "federation_token", "session_token"},
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "credential_type must be provided.")
        @JsonProperty("credential_type")
        String credentialType
) {
}
