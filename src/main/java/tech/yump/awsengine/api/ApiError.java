package tech.yump.awsengine.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

/**
 * Error body shape documented for the OpenAPI schema. Handlers emit {@code ProblemDetail}
 * bodies carrying the same message as {@code detail}.
 */
@Schema(description = "Standard error response format")
public record ApiError(
        @Schema(description = "Detailed error message.", example = "the username generated by the template exceeds the STS username length limits of 32 chars", requiredMode = Schema.RequiredMode.REQUIRED)
        String message,
        @Schema(description = "Timestamp when the error occurred.", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant timestamp
) {
    public ApiError(String message) {
        this(message, Instant.now());
    }
}
