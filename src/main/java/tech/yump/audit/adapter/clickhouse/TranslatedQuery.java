package tech.yump.audit.adapter.clickhouse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQL fragments produced from a query list, each either empty or starting with a space, plus the values
 * bound to their placeholders.
 */
record TranslatedQuery(String where, String orderBy, String limit, String offset, Map<String, Object> params) {

    static final String LIMIT_PARAM = "limit";
    static final String OFFSET_PARAM = "offset";

    TranslatedQuery {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * The same filter without ordering and pagination.
     */
    TranslatedQuery forCount() {
        Map<String, Object> filterParams = new LinkedHashMap<>(params);
        filterParams.remove(LIMIT_PARAM);
        filterParams.remove(OFFSET_PARAM);
        return new TranslatedQuery(where, "", "", "", filterParams);
    }

    String clauses() {
        return where + orderBy + limit + offset;
    }
}
