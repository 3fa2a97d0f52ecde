package tech.yump.audit.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum QueryMethod {
    EQUAL("equal"),
    LESS_THAN("lessThan"),
    GREATER_THAN("greaterThan"),
    BETWEEN("between"),
    IN("contains"),
    ORDER_ASC("orderAsc"),
    ORDER_DESC("orderDesc"),
    LIMIT("limit"),
    OFFSET("offset");

    private final String wireName;

    QueryMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isFilter() {
        return this == EQUAL || this == LESS_THAN || this == GREATER_THAN || this == BETWEEN || this == IN;
    }

    public boolean isOrder() {
        return this == ORDER_ASC || this == ORDER_DESC;
    }

    public boolean isPagination() {
        return this == LIMIT || this == OFFSET;
    }

    public static Optional<QueryMethod> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(method -> method.wireName.equals(name))
                .findFirst();
    }
}
