package tech.yump.audit.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import tech.yump.audit.service.AuditService;

/**
 * Creates the audit database and table once the application is ready, when
 * {@code audit.clickhouse.setup-on-startup} is enabled.
 */
@Component
@ConditionalOnProperty(name = "audit.clickhouse.setup-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AuditSetupRunner {

    private final AuditService auditService;

    @EventListener(ApplicationReadyEvent.class)
    public void setupOnStartup() {
        log.info("Running audit storage setup on startup");
        auditService.setup();
    }
}
