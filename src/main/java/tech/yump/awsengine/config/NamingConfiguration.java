package tech.yump.awsengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import tech.yump.awsengine.secrets.aws.naming.UsernameTemplateDefaults;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateFunctions;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Wires the username generation primitives: the clock behind {@code unix_time}, the random
 * source behind {@code random}, and the default username template.
 */
@Configuration
@Slf4j
public class NamingConfiguration {

    @Bean
    public Clock namingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TemplateFunctions templateFunctions(Clock namingClock) {
        return new TemplateFunctions(namingClock, new SecureRandom());
    }

    @Bean
    public UsernameTemplateDefaults usernameTemplateDefaults(AwsEngineProperties properties) {
        String configured = properties.naming().defaultUsernameTemplate();
        if (StringUtils.hasText(configured)) {
            log.info("Using configured default username template (awsengine.naming.default-username-template)");
            return new UsernameTemplateDefaults(configured);
        }
        return UsernameTemplateDefaults.builtIn();
    }
}
