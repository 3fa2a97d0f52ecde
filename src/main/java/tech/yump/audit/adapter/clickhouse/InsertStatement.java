package tech.yump.audit.adapter.clickhouse;

import tech.yump.audit.log.Log;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A single- or multi-row INSERT: the column list, one placeholder tuple per row, the bound values, and the
 * logs as they will be stored.
 */
record InsertStatement(List<String> columns, List<String> rows, Map<String, Object> params, List<Log> logs) {

    String sql(String qualifiedTable) {
        String columnList = columns.stream()
                .map(ClickHouseIdentifiers::escape)
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + qualifiedTable + " (" + columnList + ") VALUES " + String.join(", ", rows);
    }
}
