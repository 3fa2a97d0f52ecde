package tech.yump.audit.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

/**
 * The canonical audit attribute sets.
 */
public final class AuditSchemas {

    public static final String ID = "id";
    public static final String TENANT = "tenant";

    public static final String USER_ID = "userId";
    public static final String EVENT = "event";
    public static final String RESOURCE = "resource";
    public static final String USER_AGENT = "userAgent";
    public static final String IP = "ip";
    public static final String LOCATION = "location";
    public static final String TIME = "time";
    public static final String DATA = "data";

    public static final String USER_TYPE = "userType";
    public static final String USER_INTERNAL_ID = "userInternalId";
    public static final String RESOURCE_PARENT = "resourceParent";
    public static final String RESOURCE_TYPE = "resourceType";
    public static final String RESOURCE_ID = "resourceId";
    public static final String RESOURCE_INTERNAL_ID = "resourceInternalId";
    public static final String PROJECT_ID = "projectId";
    public static final String PROJECT_INTERNAL_ID = "projectInternalId";
    public static final String TEAM_ID = "teamId";
    public static final String TEAM_INTERNAL_ID = "teamInternalId";
    public static final String COUNTRY = "country";
    public static final String HOSTNAME = "hostname";

    static final int LENGTH_KEY = 255;

    private AuditSchemas() {
    }

    public static SchemaPart base() {
        return new SchemaPart(
                List.of(
                        AttributeDescriptor.text(USER_ID, LENGTH_KEY, false),
                        AttributeDescriptor.text(EVENT, 255, true),
                        AttributeDescriptor.text(RESOURCE, 255, false),
                        AttributeDescriptor.text(USER_AGENT, 65534, true),
                        AttributeDescriptor.text(IP, 45, true),
                        AttributeDescriptor.text(LOCATION, 45, false),
                        AttributeDescriptor.datetime(TIME, false),
                        AttributeDescriptor.json(DATA, 16777216)
                ),
                List.of(
                        IndexDescriptor.of("idx_event", EVENT),
                        IndexDescriptor.of("idx_userId_event", USER_ID, EVENT),
                        IndexDescriptor.of("idx_resource_event", RESOURCE, EVENT),
                        IndexDescriptor.of("idx_time_desc", TIME)
                ));
    }

    public static SchemaPart actor() {
        return new SchemaPart(
                List.of(
                        AttributeDescriptor.text(USER_TYPE, LENGTH_KEY, false),
                        AttributeDescriptor.text(USER_INTERNAL_ID, LENGTH_KEY, false)
                ),
                List.of(
                        IndexDescriptor.of("_key_user_internal_and_event", USER_INTERNAL_ID, EVENT),
                        IndexDescriptor.of("_key_user_internal_id", USER_INTERNAL_ID),
                        IndexDescriptor.of("_key_user_type", USER_TYPE)
                ));
    }

    public static SchemaPart resource() {
        return new SchemaPart(
                List.of(
                        AttributeDescriptor.text(RESOURCE_PARENT, LENGTH_KEY, false),
                        AttributeDescriptor.text(RESOURCE_TYPE, LENGTH_KEY, false),
                        AttributeDescriptor.text(RESOURCE_ID, LENGTH_KEY, false),
                        AttributeDescriptor.text(RESOURCE_INTERNAL_ID, LENGTH_KEY, false)
                ),
                List.of(
                        IndexDescriptor.of("_key_resource_type_id", RESOURCE_TYPE, RESOURCE_ID)
                ));
    }

    public static SchemaPart project() {
        return new SchemaPart(
                List.of(
                        AttributeDescriptor.text(PROJECT_ID, LENGTH_KEY, false),
                        AttributeDescriptor.text(PROJECT_INTERNAL_ID, LENGTH_KEY, false),
                        AttributeDescriptor.text(TEAM_ID, LENGTH_KEY, false),
                        AttributeDescriptor.text(TEAM_INTERNAL_ID, LENGTH_KEY, false)
                ),
                List.of(
                        IndexDescriptor.of("_key_project_internal_id", PROJECT_INTERNAL_ID),
                        IndexDescriptor.of("_key_team_internal_id", TEAM_INTERNAL_ID)
                ));
    }

    public static SchemaPart origin() {
        return new SchemaPart(
                List.of(
                        AttributeDescriptor.text(COUNTRY, LENGTH_KEY, false),
                        AttributeDescriptor.text(HOSTNAME, LENGTH_KEY, false)
                ),
                List.of(
                        IndexDescriptor.of("_key_country", COUNTRY),
                        IndexDescriptor.of("_key_hostname", HOSTNAME)
                ));
    }

    /**
     * Base schema plus the given extensions, attached in declaration order of {@link SchemaExtension}.
     */
    public static AuditSchema withExtensions(Collection<SchemaExtension> extensions) {
        List<SchemaPart> parts = new ArrayList<>();
        parts.add(base());
        EnumSet<SchemaExtension> selected = extensions.isEmpty()
                ? EnumSet.noneOf(SchemaExtension.class)
                : EnumSet.copyOf(extensions);
        selected.forEach(extension -> parts.add(extension.part()));
        return AuditSchema.compose(parts);
    }

    public static AuditSchema full() {
        return withExtensions(EnumSet.allOf(SchemaExtension.class));
    }
}
