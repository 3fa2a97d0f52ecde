package tech.yump.audit.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A backend-agnostic filter, ordering or pagination directive.
 * <p>
 * Construction never validates: attribute names and value shapes are checked by the adapter that translates
 * the query, since only it knows the schema. Equality is structural.
 *
 * @param method    the directive
 * @param attribute the attribute it applies to, empty for {@code limit} and {@code offset}
 * @param values    the operands, in order
 */
public record Query(QueryMethod method, String attribute, List<Object> values) {

    public static final String DEFAULT_ORDER_ATTRIBUTE = "time";

    public Query {
        attribute = attribute == null ? "" : attribute;
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Query equal(String attribute, Object value) {
        return new Query(QueryMethod.EQUAL, attribute, Collections.singletonList(value));
    }

    public static Query lessThan(String attribute, Object value) {
        return new Query(QueryMethod.LESS_THAN, attribute, Collections.singletonList(value));
    }

    public static Query greaterThan(String attribute, Object value) {
        return new Query(QueryMethod.GREATER_THAN, attribute, Collections.singletonList(value));
    }

    public static Query between(String attribute, Object start, Object end) {
        return new Query(QueryMethod.BETWEEN, attribute, Arrays.asList(start, end));
    }

    public static Query in(String attribute, Collection<?> values) {
        return new Query(QueryMethod.IN, attribute, new ArrayList<>(values));
    }

    public static Query orderAsc(String attribute) {
        return new Query(QueryMethod.ORDER_ASC, attribute, List.of());
    }

    public static Query orderAsc() {
        return orderAsc(DEFAULT_ORDER_ATTRIBUTE);
    }

    public static Query orderDesc(String attribute) {
        return new Query(QueryMethod.ORDER_DESC, attribute, List.of());
    }

    public static Query orderDesc() {
        return orderDesc(DEFAULT_ORDER_ATTRIBUTE);
    }

    public static Query limit(int limit) {
        return new Query(QueryMethod.LIMIT, "", List.of(limit));
    }

    public static Query offset(int offset) {
        return new Query(QueryMethod.OFFSET, "", List.of(offset));
    }

    /**
     * First operand, or {@code null} when there is none.
     */
    public Object value() {
        return values.isEmpty() ? null : values.get(0);
    }
}
