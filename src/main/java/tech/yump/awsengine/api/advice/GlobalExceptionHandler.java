package tech.yump.awsengine.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.awsengine.audit.AuditHelper;
import tech.yump.awsengine.secrets.SecretsEngineException;
import tech.yump.awsengine.secrets.aws.ConfigNotFoundException;
import tech.yump.awsengine.secrets.aws.naming.UsernameLengthExceededException;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateRenderException;
import tech.yump.awsengine.storage.StorageException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private final AuditHelper auditHelper;

    @ExceptionHandler(ConfigNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleConfigNotFound(ConfigNotFoundException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Configuration Not Found");
        log.warn("Configuration not found: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler({TemplateRenderException.class, UsernameLengthExceededException.class})
    public ResponseEntity<ProblemDetail> handleUsernameGenerationFailure(SecretsEngineException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        String title = (ex instanceof UsernameLengthExceededException) ? "Username Too Long" : "Invalid Username Template";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(title);
        log.warn("{}: {}. Request: {} {}", title, ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorageException(StorageException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "Internal storage error.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Storage Error");
        log.error("Storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditFailure(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(SecretsEngineException.class)
    public ResponseEntity<ProblemDetail> handleSecretsEngineException(SecretsEngineException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Secrets Engine Error");
        log.error("Secrets Engine error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : error.getField() + " is invalid.")
                .sorted()
                .collect(Collectors.joining(" "));
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: validation failed. Request: {}. Details: {}", request.getDescription(false), message);

        auditValidationFailure(request, status, message);
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        // Underlying parser details are logged only
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}",
                request.getDescription(false),
                ex.getMessage());

        auditValidationFailure(request, status, message);
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent(
                "system_error",
                determineActionFromRequest(request),
                "failure",
                status.value(),
                message,
                extractContextData(request)
        );
        return ResponseEntity.status(status).body(problemDetail);
    }

    private void auditFailure(HttpServletRequest request, HttpStatus status, String message) {
        auditHelper.logHttpEvent(
                determineEventType(request),
                determineActionFromRequest(request),
                "failure",
                status.value(),
                message,
                extractContextData(request)
        );
    }

    private void auditValidationFailure(WebRequest request, HttpStatusCode status, String message) {
        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent(
                    "request_validation",
                    determineActionFromRequest(servletRequest),
                    "failure",
                    status.value(),
                    message,
                    extractContextData(servletRequest)
            );
        } else {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging.");
        }
    }

    private String determineEventType(HttpServletRequest request) {
        if (request.getRequestURI().startsWith("/v1/aws/")) {
            return "aws_operation";
        }
        return "request_error";
    }

    private String determineActionFromRequest(HttpServletRequest request) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        if (path.endsWith("/v1/aws/usernames")) return "generate_username";
        if (path.endsWith("/v1/aws/config/root")) {
            return switch (method.toUpperCase()) {
                case "GET" -> "read_config";
                case "PUT", "POST" -> "write_config";
                default -> "unknown_config";
            };
        }
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        if (request.getRequestURI().endsWith("/v1/aws/config/root")) {
            data.put("config_key", "config/root");
        }
        return data;
    }
}
