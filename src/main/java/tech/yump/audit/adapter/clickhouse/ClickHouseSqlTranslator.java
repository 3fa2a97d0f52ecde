package tech.yump.audit.adapter.clickhouse;

import lombok.RequiredArgsConstructor;
import tech.yump.audit.adapter.UnknownAttributeException;
import tech.yump.audit.adapter.UnsupportedMethodException;
import tech.yump.audit.query.Query;
import tech.yump.audit.query.QueryMethod;
import tech.yump.audit.schema.AttributeDescriptor;
import tech.yump.audit.schema.AttributeKind;
import tech.yump.audit.schema.AuditSchema;
import tech.yump.audit.schema.AuditSchemas;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a query list into parameterized WHERE/ORDER BY/LIMIT/OFFSET fragments.
 * <p>
 * Every attribute is resolved against the schema before it is quoted into the SQL text; values only ever
 * appear as {@code {paramN:Type}} placeholders. Datetime attributes are compared as {@code DateTime64(3)} so
 * range filters order by instant, not by text. When the scope filters by tenant an implicit
 * {@code tenant = {tenant:UInt64}} condition is appended after all explicit ones.
 */
@RequiredArgsConstructor
class ClickHouseSqlTranslator {

    static final String DATETIME_TYPE = "DateTime64(3)";
    static final String TENANT_PARAM = "tenant";

    private final AuditSchema schema;

    TranslatedQuery translate(List<Query> queries, TenantScope scope) {
        List<String> conditions = new ArrayList<>();
        List<String> orderBy = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        String limit = "";
        String offset = "";
        int counter = 0;

        for (Query query : queries) {
            if (query == null || query.method() == null) {
                throw new UnsupportedMethodException("Invalid query: " + query);
            }
            switch (query.method()) {
                case EQUAL, LESS_THAN, GREATER_THAN -> {
                    String column = resolve(query.attribute(), scope);
                    requireArity(query, 1);
                    if (query.value() == null && query.method() == QueryMethod.EQUAL) {
                        conditions.add(column + " IS NULL");
                    } else {
                        String name = "param" + counter++;
                        conditions.add(column + " " + operator(query) + " " + placeholder(name, query.attribute()));
                        params.put(name, operand(query.attribute(), query.value()));
                    }
                }
                case BETWEEN -> {
                    String column = resolve(query.attribute(), scope);
                    requireArity(query, 2);
                    String start = "param" + counter++;
                    String end = "param" + counter++;
                    conditions.add(column + " BETWEEN " + placeholder(start, query.attribute())
                            + " AND " + placeholder(end, query.attribute()));
                    params.put(start, operand(query.attribute(), query.values().get(0)));
                    params.put(end, operand(query.attribute(), query.values().get(1)));
                }
                case IN -> {
                    String column = resolve(query.attribute(), scope);
                    if (query.values().isEmpty()) {
                        throw new UnsupportedMethodException("Query 'contains' on '" + query.attribute()
                                + "' requires at least one value");
                    }
                    List<String> placeholders = new ArrayList<>();
                    for (Object value : query.values()) {
                        String name = "param" + counter++;
                        placeholders.add(placeholder(name, query.attribute()));
                        params.put(name, operand(query.attribute(), value));
                    }
                    conditions.add(column + " IN (" + String.join(", ", placeholders) + ")");
                }
                case ORDER_ASC -> orderBy.add(resolve(query.attribute(), scope) + " ASC");
                case ORDER_DESC -> orderBy.add(resolve(query.attribute(), scope) + " DESC");
                case LIMIT -> {
                    params.put(TranslatedQuery.LIMIT_PARAM, pagination(query));
                    limit = " LIMIT {" + TranslatedQuery.LIMIT_PARAM + ":UInt64}";
                }
                case OFFSET -> {
                    params.put(TranslatedQuery.OFFSET_PARAM, pagination(query));
                    offset = " OFFSET {" + TranslatedQuery.OFFSET_PARAM + ":UInt64}";
                }
                default -> throw new UnsupportedMethodException("Unsupported query method: " + query.method());
            }
        }

        if (scope.filtering()) {
            conditions.add(ClickHouseIdentifiers.escape(AuditSchemas.TENANT) + " = {" + TENANT_PARAM + ":UInt64}");
            params.put(TENANT_PARAM, scope.tenant());
        }

        return new TranslatedQuery(
                conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions),
                orderBy.isEmpty() ? "" : " ORDER BY " + String.join(", ", orderBy),
                limit,
                offset,
                params);
    }

    /**
     * Condition restricting a statement to the scope's tenant, empty when it does not filter.
     */
    String tenantCondition(TenantScope scope, Map<String, Object> params) {
        if (!scope.filtering()) {
            return "";
        }
        params.put(TENANT_PARAM, scope.tenant());
        return " AND " + ClickHouseIdentifiers.escape(AuditSchemas.TENANT) + " = {" + TENANT_PARAM + ":UInt64}";
    }

    /**
     * Checks the attribute is a known column and returns it quoted.
     *
     * @throws UnknownAttributeException for anything that is not a schema attribute, {@code id}, or
     *                                   {@code tenant} on shared tables
     */
    String resolve(String attribute, TenantScope scope) {
        boolean known = AuditSchemas.ID.equals(attribute)
                || (scope.sharedTables() && AuditSchemas.TENANT.equals(attribute))
                || schema.contains(attribute);
        if (!known) {
            throw new UnknownAttributeException(attribute);
        }
        return ClickHouseIdentifiers.escape(attribute);
    }

    private String placeholder(String name, String attribute) {
        return "{" + name + ":" + type(attribute) + "}";
    }

    private String type(String attribute) {
        if (AuditSchemas.TENANT.equals(attribute)) {
            return "UInt64";
        }
        return isDatetime(attribute) ? DATETIME_TYPE : "String";
    }

    private Object operand(String attribute, Object value) {
        if (value == null) {
            throw new UnsupportedMethodException("Query on '" + attribute + "' has a null value");
        }
        return isDatetime(attribute) ? ClickHouseTimestamps.formatOperand(value) : value;
    }

    private boolean isDatetime(String attribute) {
        return schema.lookup(attribute)
                .map(AttributeDescriptor::kind)
                .filter(kind -> kind == AttributeKind.DATETIME)
                .isPresent();
    }

    private String operator(Query query) {
        return switch (query.method()) {
            case EQUAL -> "=";
            case LESS_THAN -> "<";
            case GREATER_THAN -> ">";
            default -> throw new UnsupportedMethodException("No comparison operator for " + query.method());
        };
    }

    private void requireArity(Query query, int expected) {
        if (query.values().size() != expected) {
            throw new UnsupportedMethodException("Query '" + query.method().wireName() + "' on '" + query.attribute()
                    + "' requires exactly " + expected + " value" + (expected == 1 ? "" : "s")
                    + ", got " + query.values().size());
        }
    }

    private long pagination(Query query) {
        String name = query.method().wireName();
        if (query.values().size() != 1) {
            throw new UnsupportedMethodException("Invalid " + name + " value. Expected exactly one integer");
        }
        Object value = query.value();
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
            throw new UnsupportedMethodException("Invalid " + name + " value. Expected int, got " + value);
        }
        long number = ((Number) value).longValue();
        if (number < 0) {
            throw new UnsupportedMethodException("Invalid " + name + " value. Must not be negative, got " + number);
        }
        return number;
    }
}
