package tech.yump.awsengine.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.awsengine.api.ApiError;
import tech.yump.awsengine.api.dto.UsernameRequest;
import tech.yump.awsengine.api.dto.UsernameResponse;
import tech.yump.awsengine.audit.AuditHelper;
import tech.yump.awsengine.secrets.aws.AwsSecretsEngine;
import tech.yump.awsengine.secrets.aws.GeneratedUsername;

import java.util.Map;

@RestController
@RequestMapping("/v1/aws")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "AWS Usernames", description = "Generation of IAM and STS principal names")
public class AwsUsernameController {

    private final AwsSecretsEngine awsSecretsEngine;
    private final AuditHelper auditHelper;

    @PostMapping("/usernames")
    @Operation(
            summary = "Generate username",
            description = "Renders the configured username template (or the default one) for the given display name, policy name and credential type."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Username generated.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = UsernameResponse.class))),
            @ApiResponse(responseCode = "400", description = "Unknown credential type, template error, or generated name too long.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "500", description = "Storage failure while reading the configuration.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<UsernameResponse> generateUsername(@Valid @RequestBody UsernameRequest request) {
        log.info("Received request to generate a username for credential type '{}'", request.credentialType());
        GeneratedUsername generated = awsSecretsEngine.generateUsername(
                request.displayName(), request.policyName(), request.credentialType());

        auditHelper.logHttpEvent(
                "aws_operation", "generate_username", "success", HttpStatus.OK.value(),
                null, Map.of("credential_type", generated.credentialType().wireName())
        );
        return ResponseEntity.ok(UsernameResponse.from(generated));
    }
}
