package tech.yump.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.audit.config.LiteAuditProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(LiteAuditProperties.class)
public class LiteAuditApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteAuditApplication.class, args);
    log.info(">>> LiteAudit Application Started <<<");
  }
}
