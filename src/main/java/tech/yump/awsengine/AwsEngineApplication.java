package tech.yump.awsengine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.awsengine.config.AwsEngineProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(AwsEngineProperties.class)
public class AwsEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(AwsEngineApplication.class, args);
    log.info(">>> AWS Secrets Engine Application Started <<<");
  }
}
