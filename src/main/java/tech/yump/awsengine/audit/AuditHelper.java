package tech.yump.awsengine.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    /**
     * Header carrying the caller's request id; set by the routing layer in front of this service.
     */
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    /**
     * Header carrying the authenticated caller's identity; set by the routing layer.
     */
    public static final String PRINCIPAL_HEADER = "X-Vault-Principal";

    private final AuditBackend auditBackend;

    /**
     * Logs an audit event related to an HTTP request outcome (success or failure).
     * Request context is gathered from the current thread if available.
     *
     * @param type         The type of event (e.g., "aws_operation").
     * @param action       The specific action performed (e.g., "write_config").
     * @param outcome      The result ("success" or "failure").
     * @param statusCode   The HTTP status code associated with the outcome.
     * @param errorMessage Optional error message (for failures).
     * @param data         Optional map containing context-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();
        String principal = Optional.ofNullable(request)
                .map(r -> r.getHeader(PRINCIPAL_HEADER))
                .filter(StringUtils::hasText)
                .orElse("anonymous");

        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, principal, buildRequestInfo(request), responseInfo, data);
    }

    /**
     * Logs an audit event originating from internal processing (not tied to an HTTP response).
     *
     * @param type      The type of event (e.g., "aws_operation").
     * @param action    The specific action performed (e.g., "generate_username").
     * @param outcome   The result ("success" or "failure").
     * @param principal Optional principal identifier; defaults to "system".
     * @param data      Optional map containing context-specific data.
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {

        String effectivePrincipal = Optional.ofNullable(principal).orElse("system");
        logEventInternal(type, action, outcome, effectivePrincipal, null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            String principal,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .principal(principal)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            // Audit failures are logged, never propagated to the caller
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId(request.getHeader(REQUEST_ID_HEADER))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .sourceAddress(request.getRemoteAddr())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
