package tech.yump.awsengine.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "System", description = "System information and status endpoints")
public class RootController {

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Provides a simple welcome message and status check."
  )
  @ApiResponse(responseCode = "200", description = "Welcome message and status.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"AWS Secrets Engine\", \"status\": \"OK\"}")))
  public Map<String, String> getRoot() {
    return Map.of("message", "AWS Secrets Engine", "status", "OK");
  }
}
