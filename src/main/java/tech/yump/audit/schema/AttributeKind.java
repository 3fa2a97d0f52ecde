package tech.yump.audit.schema;

public enum AttributeKind {
    TEXT,
    DATETIME,
    JSON
}
