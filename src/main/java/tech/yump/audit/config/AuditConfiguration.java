package tech.yump.audit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import tech.yump.audit.adapter.AuditAdapter;
import tech.yump.audit.adapter.clickhouse.ClickHouseAdapter;
import tech.yump.audit.adapter.clickhouse.ClickHouseClient;
import tech.yump.audit.adapter.clickhouse.ClickHouseSettings;
import tech.yump.audit.schema.AuditSchema;
import tech.yump.audit.schema.AuditSchemas;

@Configuration
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;
    private final LiteAuditProperties properties;

    public AuditConfiguration(ObjectMapper objectMapper, LiteAuditProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Bean
    public AuditSchema auditSchema() {
        AuditSchema schema = AuditSchemas.withExtensions(properties.schema().extensions());
        log.info("Audit schema configured with extensions {} ({} attributes, {} indexes)",
                properties.schema().extensions(), schema.attributes().size(), schema.indexes().size());
        return schema;
    }

    @Bean
    @ConditionalOnProperty(name = "audit.backend", havingValue = LiteAuditProperties.BACKEND_CLICKHOUSE, matchIfMissing = true)
    public ClickHouseClient clickHouseClient(RestClient.Builder restClientBuilder) {
        ClickHouseSettings settings = properties.clickhouse().toSettings();
        return new ClickHouseClient(
                restClientBuilder.requestFactory(ClickHouseClient.requestFactory(settings)),
                settings);
    }

    @Bean
    @ConditionalOnProperty(name = "audit.backend", havingValue = LiteAuditProperties.BACKEND_CLICKHOUSE, matchIfMissing = true)
    public AuditAdapter clickHouseAuditAdapter(ClickHouseClient clickHouseClient, AuditSchema auditSchema) {
        LiteAuditProperties.ClickHouseProperties clickhouse = properties.clickhouse();
        log.info("Configuring ClickHouse Audit Adapter: {}", clickhouse);
        return new ClickHouseAdapter(clickHouseClient, auditSchema, objectMapper)
                .setDatabase(clickhouse.database())
                .setNamespace(clickhouse.namespace())
                .setTenant(clickhouse.tenant())
                .setSharedTables(clickhouse.sharedTables());
    }
}
