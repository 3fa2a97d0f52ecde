package tech.yump.audit.adapter;

import lombok.Getter;

@Getter
public class TruncatedRowException extends AuditException {

    private final int expectedColumns;
    private final int actualColumns;

    public TruncatedRowException(int expectedColumns, int actualColumns) {
        super("Row has " + actualColumns + " tab-separated fields, expected " + expectedColumns);
        this.expectedColumns = expectedColumns;
        this.actualColumns = actualColumns;
    }
}
