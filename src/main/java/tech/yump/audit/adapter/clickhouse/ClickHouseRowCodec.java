package tech.yump.audit.adapter.clickhouse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.audit.adapter.CorruptRowException;
import tech.yump.audit.adapter.InvalidLogDataException;
import tech.yump.audit.adapter.MissingRequiredAttributeException;
import tech.yump.audit.adapter.TruncatedRowException;
import tech.yump.audit.log.Log;
import tech.yump.audit.schema.AttributeDescriptor;
import tech.yump.audit.schema.AttributeKind;
import tech.yump.audit.schema.AuditSchema;
import tech.yump.audit.schema.AuditSchemas;
import tech.yump.audit.schema.ResourcePath;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Encodes logs into INSERT statements and decodes {@code TabSeparated} result bodies back into logs.
 * <p>
 * {@link #selectColumns(TenantScope)} is the single source of the column order: it is the SELECT list and
 * the order in which result fields are read.
 */
@Slf4j
@RequiredArgsConstructor
class ClickHouseRowCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final AuditSchema schema;
    private final ObjectMapper objectMapper;

    /**
     * {@code id}, every schema attribute in registration order except {@code data}, {@code data}, then
     * {@code tenant} on shared tables.
     */
    List<String> selectColumns(TenantScope scope) {
        List<String> columns = new ArrayList<>();
        columns.add(AuditSchemas.ID);
        schema.attributes().stream()
                .map(AttributeDescriptor::name)
                .filter(name -> !AuditSchemas.DATA.equals(name))
                .forEach(columns::add);
        if (schema.contains(AuditSchemas.DATA)) {
            columns.add(AuditSchemas.DATA);
        }
        if (scope.sharedTables()) {
            columns.add(AuditSchemas.TENANT);
        }
        return columns;
    }

    String selectList(TenantScope scope) {
        return selectColumns(scope).stream()
                .map(ClickHouseIdentifiers::escape)
                .collect(Collectors.joining(", "));
    }

    // ---- encode ----

    /**
     * Builds one INSERT for all logs. Each log must already carry its id and time.
     *
     * @throws MissingRequiredAttributeException when any log lacks a required attribute; raised before any
     *                                           statement is produced
     */
    InsertStatement encode(List<Log> logs, TenantScope scope) {
        boolean batch = logs.size() > 1;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < logs.size(); i++) {
            rows.add(columnValues(logs.get(i), batch ? i : -1));
        }

        Set<String> present = new LinkedHashSet<>();
        for (AttributeDescriptor attribute : schema.attributes()) {
            String name = attribute.name();
            if (AuditSchemas.DATA.equals(name)) {
                continue;
            }
            if (AuditSchemas.TIME.equals(name) || rows.stream().anyMatch(row -> row.get(name) != null)) {
                present.add(name);
            }
        }

        List<String> columns = new ArrayList<>();
        columns.add(AuditSchemas.ID);
        columns.addAll(present);
        if (schema.contains(AuditSchemas.DATA)) {
            columns.add(AuditSchemas.DATA);
        }
        if (scope.sharedTables()) {
            columns.add(AuditSchemas.TENANT);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        List<String> tuples = new ArrayList<>();
        List<Log> stored = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            if (scope.sharedTables()) {
                row.put(AuditSchemas.TENANT, scope.tenant());
            }
            List<String> placeholders = new ArrayList<>();
            for (String column : columns) {
                String param = column + "_" + i;
                placeholders.add("{" + param + ":" + insertType(column) + "}");
                params.put(param, wireValue(column, row.get(column)));
            }
            tuples.add("(" + String.join(", ", placeholders) + ")");
            stored.add(Log.fromAttributes(row));
        }
        return new InsertStatement(columns, tuples, params, stored);
    }

    private Map<String, Object> columnValues(Log entry, int row) {
        Map<String, Object> data = new LinkedHashMap<>(entry.data());
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(AuditSchemas.ID, entry.id());

        for (AttributeDescriptor attribute : schema.attributes()) {
            String name = attribute.name();
            if (AuditSchemas.DATA.equals(name)) {
                continue;
            }
            Object value = entry.attribute(name);
            if (value == null && attribute.kind() == AttributeKind.TEXT && data.get(name) != null) {
                value = String.valueOf(data.remove(name));
            }
            values.put(name, value);
        }

        decomposeResource(values);

        for (AttributeDescriptor attribute : schema.attributes()) {
            if (attribute.required() && values.get(attribute.name()) == null) {
                throw row < 0
                        ? new MissingRequiredAttributeException(attribute.name())
                        : new MissingRequiredAttributeException(attribute.name(), row);
            }
        }

        values.put(AuditSchemas.DATA, data);
        return values;
    }

    private void decomposeResource(Map<String, Object> values) {
        Object resource = values.get(AuditSchemas.RESOURCE);
        if (resource == null) {
            return;
        }
        ResourcePath.parse(resource.toString()).ifPresent(path -> {
            fillIfAbsent(values, AuditSchemas.RESOURCE_TYPE, path.type());
            fillIfAbsent(values, AuditSchemas.RESOURCE_ID, path.id());
            fillIfAbsent(values, AuditSchemas.RESOURCE_PARENT, path.parent());
        });
    }

    private void fillIfAbsent(Map<String, Object> values, String name, String derived) {
        if (schema.contains(name) && values.get(name) == null && derived != null) {
            values.put(name, derived);
        }
    }

    private String insertType(String column) {
        if (AuditSchemas.TENANT.equals(column)) {
            return "Nullable(UInt64)";
        }
        if (AuditSchemas.ID.equals(column)) {
            return "String";
        }
        AttributeDescriptor attribute = schema.lookup(column).orElseThrow();
        String type = attribute.kind() == AttributeKind.DATETIME ? ClickHouseSqlTranslator.DATETIME_TYPE : "String";
        boolean nullable = !attribute.required() && !AuditSchemas.TIME.equals(column);
        return nullable ? "Nullable(" + type + ")" : type;
    }

    private Object wireValue(String column, Object value) {
        if (value == null) {
            return null;
        }
        if (AuditSchemas.DATA.equals(column)) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new InvalidLogDataException("Log data is not JSON serializable: " + e.getOriginalMessage(), e);
            }
        }
        if (value instanceof Instant instant) {
            return ClickHouseTimestamps.format(instant);
        }
        return value;
    }

    // ---- decode ----

    /**
     * Decodes a {@code TabSeparated} body selected with {@link #selectList(TenantScope)}.
     *
     * @throws TruncatedRowException when a row has fewer fields than selected columns
     * @throws CorruptRowException   when a row has more fields, or a field cannot be parsed
     */
    List<Log> decode(String body, TenantScope scope) {
        List<Log> logs = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return logs;
        }
        List<String> columns = selectColumns(scope);
        for (String line : body.split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            String[] fields = line.split("\t", -1);
            if (fields.length < columns.size()) {
                log.warn("Truncated ClickHouse row: expected {} fields, got {}", columns.size(), fields.length);
                throw new TruncatedRowException(columns.size(), fields.length);
            }
            if (fields.length > columns.size()) {
                log.warn("Corrupt ClickHouse row: expected {} fields, got {}", columns.size(), fields.length);
                throw new CorruptRowException("Expected " + columns.size() + " fields per row, got " + fields.length);
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i), decodeField(columns.get(i), fields[i]));
            }
            logs.add(Log.fromAttributes(values));
        }
        return logs;
    }

    private Object decodeField(String column, String raw) {
        if (AuditSchemas.ID.equals(column)) {
            return unescape(raw);
        }
        if (AuditSchemas.TENANT.equals(column)) {
            if (isAbsent(raw)) {
                return null;
            }
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                throw new CorruptRowException("Invalid tenant in result row: " + raw, e);
            }
        }

        AttributeDescriptor attribute = schema.lookup(column).orElseThrow();
        if (!attribute.required() && isAbsent(raw)) {
            return attribute.kind() == AttributeKind.JSON ? Map.of() : null;
        }
        String value = unescape(raw);
        return switch (attribute.kind()) {
            case TEXT -> value;
            case DATETIME -> ClickHouseTimestamps.parse(value);
            case JSON -> parseJson(column, value);
        };
    }

    private Map<String, Object> parseJson(String column, String value) {
        try {
            Map<String, Object> parsed = objectMapper.readValue(value, DATA_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Column '{}' holds invalid JSON", column);
            throw new CorruptRowException("Invalid JSON in column '" + column + "': " + e.getOriginalMessage(), e);
        }
    }

    private boolean isAbsent(String raw) {
        return raw.isEmpty() || ClickHouseClient.NULL_MARKER.equals(raw);
    }

    /**
     * Undoes the escaping the engine applies to {@code TabSeparated} fields.
     */
    static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder out = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i == raw.length() - 1) {
                out.append(c);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case '0' -> out.append('\0');
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }
}
