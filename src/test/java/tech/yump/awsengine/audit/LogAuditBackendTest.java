package tech.yump.awsengine.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@ExtendWith(OutputCaptureExtension.class)
class LogAuditBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final LogAuditBackend backend = new LogAuditBackend(objectMapper);

    @Test
    @DisplayName("logEvent: writes the event as JSON, omitting null sections")
    void logEvent_writesJson(CapturedOutput output) {
        AuditEvent event = AuditEvent.builder()
                .timestamp(Instant.ofEpochSecond(1_700_000_000L))
                .type("aws_operation")
                .action("generate_username")
                .outcome("success")
                .principal("system")
                .data(Map.of("credential_type", "sts"))
                .build();

        backend.logEvent(event);

        assertThat(output.getOut())
                .contains("AUDIT_EVENT:")
                .contains("\"type\":\"aws_operation\"")
                .contains("\"credential_type\":\"sts\"")
                .doesNotContain("requestInfo");
    }

    @Test
    @DisplayName("logEvent: null event is ignored")
    void logEvent_null() {
        assertThatCode(() -> backend.logEvent(null)).doesNotThrowAnyException();
    }
}
