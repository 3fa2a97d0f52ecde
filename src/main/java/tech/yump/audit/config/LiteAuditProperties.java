package tech.yump.audit.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import tech.yump.audit.adapter.clickhouse.ClickHouseSettings;
import tech.yump.audit.adapter.clickhouse.Compression;
import tech.yump.audit.schema.SchemaExtension;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

/**
 * Configuration properties for the audit service under the 'audit' prefix.
 */
@ConfigurationProperties(prefix = "audit")
@Validated
public record LiteAuditProperties(

        @NotBlank(message = "Audit backend (audit.backend) must be provided.")
        String backend,

        @Valid
        ClickHouseProperties clickhouse,

        @Valid
        SchemaProperties schema
) {

    public static final String BACKEND_CLICKHOUSE = "clickhouse";

    public LiteAuditProperties {
        if (backend == null) {
            backend = BACKEND_CLICKHOUSE;
        }
        if (schema == null) {
            schema = new SchemaProperties(null);
        }
    }

    @AssertTrue(message = "ClickHouse configuration (audit.clickhouse) is required when audit.backend is 'clickhouse'.")
    private boolean isClickhouseConfigured() {
        return !BACKEND_CLICKHOUSE.equals(backend) || clickhouse != null;
    }

    // --- ClickHouseProperties ---
    @Validated
    public record ClickHouseProperties(
            @NotBlank(message = "ClickHouse host (audit.clickhouse.host) must be provided.")
            String host,

            @Min(value = 1, message = "ClickHouse port (audit.clickhouse.port) must be between 1 and 65535.")
            @Max(value = 65535, message = "ClickHouse port (audit.clickhouse.port) must be between 1 and 65535.")
            Integer port,

            String username,

            String password,

            boolean secure,

            Duration timeout,

            Compression compression,

            String database,

            String namespace,

            @PositiveOrZero(message = "Tenant (audit.clickhouse.tenant) must not be negative.")
            Long tenant,

            boolean sharedTables,

            boolean setupOnStartup
    ) {
        public ClickHouseProperties {
            if (port == null) {
                port = ClickHouseSettings.DEFAULT_PORT;
            }
            if (username == null) {
                username = "default";
            }
            if (password == null) {
                password = "";
            }
            if (timeout == null) {
                timeout = ClickHouseSettings.DEFAULT_TIMEOUT;
            }
            if (compression == null) {
                compression = Compression.NONE;
            }
            if (database == null) {
                database = "default";
            }
            if (namespace == null) {
                namespace = "";
            }
        }

        @AssertTrue(message = "ClickHouse timeout (audit.clickhouse.timeout) must be between 1s and 600s.")
        private boolean isTimeoutInRange() {
            return timeout.compareTo(ClickHouseSettings.MIN_TIMEOUT) >= 0
                    && timeout.compareTo(ClickHouseSettings.MAX_TIMEOUT) <= 0;
        }

        public ClickHouseSettings toSettings() {
            return new ClickHouseSettings(host, port, username, password, secure, timeout, compression);
        }

        @Override
        public String toString() {
            // Avoid logging the password in toString()
            return "ClickHouseProperties[" +
                    "host='" + host + '\'' +
                    ", port=" + port +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ", secure=" + secure +
                    ", timeout=" + timeout +
                    ", compression=" + compression +
                    ", database='" + database + '\'' +
                    ", namespace='" + namespace + '\'' +
                    ", tenant=" + tenant +
                    ", sharedTables=" + sharedTables +
                    ", setupOnStartup=" + setupOnStartup +
                    ']';
        }
    }

    // --- SchemaProperties ---
    @Validated
    public record SchemaProperties(
            @NotNull
            List<SchemaExtension> extensions
    ) {
        public SchemaProperties {
            if (extensions == null) {
                extensions = List.copyOf(EnumSet.allOf(SchemaExtension.class));
            }
        }
    }
}
