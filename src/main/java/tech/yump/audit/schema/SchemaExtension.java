package tech.yump.audit.schema;

/**
 * Named attribute sets that can be attached to {@link AuditSchemas#base()}.
 */
public enum SchemaExtension {
    ACTOR,
    RESOURCE,
    PROJECT,
    ORIGIN;

    public SchemaPart part() {
        return switch (this) {
            case ACTOR -> AuditSchemas.actor();
            case RESOURCE -> AuditSchemas.resource();
            case PROJECT -> AuditSchemas.project();
            case ORIGIN -> AuditSchemas.origin();
        };
    }
}
