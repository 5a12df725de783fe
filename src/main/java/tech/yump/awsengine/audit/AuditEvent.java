package tech.yump.awsengine.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry, logged as JSON.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "aws_operation"
        String action,          // e.g. "write_config", "generate_username"
        String outcome,         // "success" or "failure"
        String principal,       // caller identity as passed in, "system" for internal events
        RequestInfo requestInfo,
        ResponseInfo responseInfo,
        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            String sourceAddress,
            Map<String, String> headers // non-sensitive only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
