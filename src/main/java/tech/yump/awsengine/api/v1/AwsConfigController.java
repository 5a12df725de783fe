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
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.awsengine.api.ApiError;
import tech.yump.awsengine.api.dto.RootConfigRequest;
import tech.yump.awsengine.api.dto.RootConfigResponse;
import tech.yump.awsengine.audit.AuditHelper;
import tech.yump.awsengine.secrets.aws.AwsSecretsEngine;
import tech.yump.awsengine.secrets.aws.RootConfig;

import java.util.Map;

@RestController
@RequestMapping("/v1/aws/config")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "AWS Configuration", description = "Root configuration of the AWS secrets engine")
public class AwsConfigController {

    private final AwsSecretsEngine awsSecretsEngine;
    private final AuditHelper auditHelper;

    @PutMapping("/root")
    @Operation(
            summary = "Write root configuration",
            description = "Stores the root configuration. An empty or missing username_template is replaced by the default template before storing."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Configuration written successfully."),
            @ApiResponse(responseCode = "400", description = "Invalid request body.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "500", description = "Storage failure while writing.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> writeRootConfig(@Valid @RequestBody RootConfigRequest request) {
        log.info("Received request to write AWS root configuration (custom template: {})",
                StringUtils.hasLength(request.usernameTemplate()));
        awsSecretsEngine.writeRootConfig(request.toRootConfig());

        auditHelper.logHttpEvent(
                "aws_operation", "write_config", "success", HttpStatus.NO_CONTENT.value(),
                null, Map.of("config_key", "config/root")
        );
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/root")
    @Operation(
            summary = "Read root configuration",
            description = "Returns the stored root configuration. The password is never returned; the username_template is returned exactly as stored."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Configuration found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = RootConfigResponse.class))),
            @ApiResponse(responseCode = "404", description = "No configuration has been written.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "500", description = "Storage failure while reading.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<RootConfigResponse> readRootConfig() {
        log.debug("Received request to read AWS root configuration");
        RootConfig config = awsSecretsEngine.readRootConfig();

        auditHelper.logHttpEvent(
                "aws_operation", "read_config", "success", HttpStatus.OK.value(),
                null, Map.of("config_key", "config/root")
        );
        return ResponseEntity.ok(RootConfigResponse.from(config));
    }
}
