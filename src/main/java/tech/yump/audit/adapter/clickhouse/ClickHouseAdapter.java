package tech.yump.audit.adapter.clickhouse;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tech.yump.audit.adapter.AbstractAuditAdapter;
import tech.yump.audit.adapter.CorruptRowException;
import tech.yump.audit.adapter.InvalidConfigurationException;
import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;
import tech.yump.audit.schema.AttributeDescriptor;
import tech.yump.audit.schema.AttributeKind;
import tech.yump.audit.schema.AuditSchema;
import tech.yump.audit.schema.AuditSchemas;
import tech.yump.audit.schema.IndexDescriptor;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Audit adapter storing logs in a ClickHouse {@code MergeTree} table through its HTTP interface.
 * <p>
 * The table is {@code <namespace>_audits} (or {@code audits} without a namespace) in the active database.
 * With shared tables enabled the table carries a {@code tenant} column, every insert is stamped with the
 * configured tenant and every read, count and cleanup is restricted to it.
 * <p>
 * Deletion is a background mutation in ClickHouse: rows removed by {@link #cleanup(Instant)} may remain
 * visible for a short while. Configuration setters must not be called concurrently with operations.
 */
@Slf4j
public class ClickHouseAdapter extends AbstractAuditAdapter {

    public static final String NAME = "ClickHouse";
    public static final String DEFAULT_DATABASE = "default";
    public static final String DEFAULT_TABLE = "audits";

    private final ClickHouseClient client;
    private final AuditSchema schema;
    private final ClickHouseSqlTranslator translator;
    private final ClickHouseRowCodec codec;

    private String database = DEFAULT_DATABASE;
    private String namespace = "";
    private Long tenant;
    private boolean sharedTables;

    public ClickHouseAdapter(ClickHouseClient client, AuditSchema schema, ObjectMapper objectMapper) {
        this.client = client;
        this.schema = schema;
        this.translator = new ClickHouseSqlTranslator(schema);
        this.codec = new ClickHouseRowCodec(schema, objectMapper);
    }

    @Override
    public String getName() {
        return NAME;
    }

    public ClickHouseAdapter setDatabase(String database) {
        this.database = ClickHouseIdentifiers.validate(database, "Database");
        return this;
    }

    public String getDatabase() {
        return database;
    }

    /**
     * Table name prefix; an empty namespace means no prefix.
     */
    public ClickHouseAdapter setNamespace(String namespace) {
        if (namespace != null && !namespace.isEmpty()) {
            ClickHouseIdentifiers.validate(namespace, "Namespace");
        }
        this.namespace = namespace == null ? "" : namespace;
        return this;
    }

    public String getNamespace() {
        return namespace;
    }

    public ClickHouseAdapter setTenant(Long tenant) {
        if (tenant != null && tenant < 0) {
            throw new InvalidConfigurationException("Tenant must not be negative");
        }
        this.tenant = tenant;
        return this;
    }

    public Long getTenant() {
        return tenant;
    }

    public ClickHouseAdapter setSharedTables(boolean sharedTables) {
        this.sharedTables = sharedTables;
        return this;
    }

    public boolean isSharedTables() {
        return sharedTables;
    }

    public AuditSchema getSchema() {
        return schema;
    }

    String tableName() {
        String table = namespace.isEmpty() ? DEFAULT_TABLE : namespace + "_" + DEFAULT_TABLE;
        return ClickHouseIdentifiers.validate(table, "Table");
    }

    private String qualifiedTable() {
        return ClickHouseIdentifiers.qualified(database, tableName());
    }

    private TenantScope scope() {
        return new TenantScope(sharedTables, tenant);
    }

    @Override
    public void setup() {
        log.debug("Creating database {} if absent", database);
        client.query(null, "CREATE DATABASE IF NOT EXISTS " + ClickHouseIdentifiers.escape(database), Map.of());

        List<String> definitions = new ArrayList<>();
        definitions.add(ClickHouseIdentifiers.escape(AuditSchemas.ID) + " String");
        for (AttributeDescriptor attribute : schema.attributes()) {
            definitions.add(ClickHouseIdentifiers.escape(attribute.name()) + " " + columnType(attribute));
        }
        if (sharedTables) {
            definitions.add(ClickHouseIdentifiers.escape(AuditSchemas.TENANT) + " Nullable(UInt64)");
        }
        for (IndexDescriptor index : schema.indexes()) {
            String columns = index.attributes().stream()
                    .map(ClickHouseIdentifiers::escape)
                    .collect(Collectors.joining(", "));
            definitions.add("INDEX " + ClickHouseIdentifiers.escape(index.name())
                    + " (" + columns + ") TYPE bloom_filter GRANULARITY 1");
        }

        String sql = "CREATE TABLE IF NOT EXISTS " + qualifiedTable() + " ("
                + String.join(", ", definitions) + ")"
                + " ENGINE = MergeTree()"
                + " ORDER BY (" + ClickHouseIdentifiers.escape(AuditSchemas.TIME) + ", "
                + ClickHouseIdentifiers.escape(AuditSchemas.ID) + ")"
                + " PARTITION BY toYYYYMM(" + ClickHouseIdentifiers.escape(AuditSchemas.TIME) + ")"
                + " SETTINGS index_granularity = 8192";
        log.debug("Creating table {} if absent", qualifiedTable());
        client.query(database, sql, Map.of());
        log.info("ClickHouse audit table {} is ready", qualifiedTable());
    }

    private String columnType(AttributeDescriptor attribute) {
        // time is the partition and sort key, it cannot be nullable
        if (AuditSchemas.TIME.equals(attribute.name())) {
            return ClickHouseSqlTranslator.DATETIME_TYPE;
        }
        String type = attribute.kind() == AttributeKind.DATETIME ? ClickHouseSqlTranslator.DATETIME_TYPE : "String";
        return attribute.required() ? type : "Nullable(" + type + ")";
    }

    @Override
    public Log create(Log entry) {
        return insert(List.of(entry)).get(0);
    }

    @Override
    public List<Log> createBatch(List<Log> logs) {
        if (logs == null || logs.isEmpty()) {
            return List.of();
        }
        List<Log> stored = insert(logs);
        log.info("Stored batch of {} audit logs", stored.size());
        return stored;
    }

    private List<Log> insert(List<Log> logs) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        List<Log> prepared = logs.stream()
                .map(entry -> entry.toBuilder()
                        .id(UUID.randomUUID().toString())
                        .time(entry.time() == null ? now : entry.time().truncatedTo(ChronoUnit.MILLIS))
                        .build())
                .toList();
        InsertStatement statement = codec.encode(prepared, scope());
        log.debug("Inserting {} row(s) into {}", prepared.size(), qualifiedTable());
        client.query(database, statement.sql(qualifiedTable()), statement.params());
        return statement.logs();
    }

    @Override
    public Optional<Log> getById(String id) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", id);
        String sql = "SELECT " + codec.selectList(scope())
                + " FROM " + qualifiedTable()
                + " WHERE " + ClickHouseIdentifiers.escape(AuditSchemas.ID) + " = {id:String}"
                + translator.tenantCondition(scope(), params)
                + " LIMIT 1 FORMAT TabSeparated";
        log.debug("Fetching audit log by id from {}", qualifiedTable());
        List<Log> logs = codec.decode(client.query(database, sql, params), scope());
        return logs.stream().findFirst();
    }

    @Override
    public List<Log> find(List<Query> queries) {
        TranslatedQuery translated = translator.translate(queries == null ? List.of() : queries, scope());
        String sql = "SELECT " + codec.selectList(scope())
                + " FROM " + qualifiedTable()
                + translated.clauses()
                + " FORMAT TabSeparated";
        log.debug("Finding audit logs in {} with {} condition(s)", qualifiedTable(), queries == null ? 0 : queries.size());
        return codec.decode(client.query(database, sql, translated.params()), scope());
    }

    @Override
    public long count(List<Query> queries) {
        TranslatedQuery translated = translator.translate(queries == null ? List.of() : queries, scope()).forCount();
        String sql = "SELECT count() FROM " + qualifiedTable()
                + translated.clauses()
                + " FORMAT TabSeparated";
        log.debug("Counting audit logs in {}", qualifiedTable());
        String response = client.query(database, sql, translated.params());
        String body = response == null ? "" : response.trim();
        if (body.isEmpty()) {
            log.warn("ClickHouse returned no row for a count");
            throw new CorruptRowException("Count query returned no result row");
        }
        try {
            return Long.parseLong(body);
        } catch (NumberFormatException e) {
            log.warn("ClickHouse returned a non-numeric count");
            throw new CorruptRowException("Invalid count in result: " + body, e);
        }
    }

    @Override
    public boolean cleanup(Instant threshold) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("datetime", ClickHouseTimestamps.format(threshold));
        String sql = "DELETE FROM " + qualifiedTable()
                + " WHERE " + ClickHouseIdentifiers.escape(AuditSchemas.TIME) + " < {datetime:"
                + ClickHouseSqlTranslator.DATETIME_TYPE + "}"
                + translator.tenantCondition(scope(), params);
        log.info("Deleting audit logs older than {} from {}", threshold, qualifiedTable());
        client.query(database, sql, params);
        return true;
    }
}
