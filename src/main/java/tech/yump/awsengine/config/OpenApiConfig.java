package tech.yump.awsengine.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.awsengine.audit.AuditHelper;

@Configuration
public class OpenApiConfig {

    private static final String PRINCIPAL_SCHEME_NAME = "CallerPrincipal";

    @Bean
    public OpenAPI customOpenAPI() {
        // Identity is established upstream; the header is only recorded in audit events.
        SecurityScheme principalScheme = new SecurityScheme()
                .name(AuditHelper.PRINCIPAL_HEADER)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Identity of the authenticated caller ('" + AuditHelper.PRINCIPAL_HEADER
                        + "'), forwarded by the routing layer and recorded in audit events.");

        return new OpenAPI()
                .info(new Info()
                        .title("AWS Secrets Engine API")
                        .version("v1")
                        .description("Root configuration and IAM/STS username generation for the AWS secrets engine."))
                .components(new Components()
                        .addSecuritySchemes(PRINCIPAL_SCHEME_NAME, principalScheme));
    }
}
