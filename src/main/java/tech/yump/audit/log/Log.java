package tech.yump.audit.log;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import tech.yump.audit.schema.AuditSchemas;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single audit log entry: who did what, to what, when and from where.
 * <p>
 * Base attributes and the attributes of every schema extension have a dedicated component. Anything else the
 * caller wants to keep goes into {@link #data()}; keys of {@code data} that match a schema column are stored in
 * that column.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Log(
        String id,                  // Assigned by the adapter on creation
        String event,               // e.g. "document.update"
        String userAgent,
        String ip,
        String userId,
        String userType,
        String userInternalId,
        String resource,            // Hierarchical, e.g. "database/db1/collection/col1"
        String resourceType,
        String resourceId,
        String resourceParent,
        String resourceInternalId,
        String location,
        String country,
        String hostname,
        String projectId,
        String projectInternalId,
        String teamId,
        String teamInternalId,
        Instant time,               // Defaults to "now" when absent on creation
        Map<String, Object> data,
        Long tenant                 // Only set when tables are shared between tenants
) {

    public Log {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Value of a named attribute, falling back to {@link #data()} for names without a dedicated component.
     */
    @JsonIgnore
    public Object attribute(String name) {
        return switch (name) {
            case AuditSchemas.ID -> id;
            case AuditSchemas.EVENT -> event;
            case AuditSchemas.USER_AGENT -> userAgent;
            case AuditSchemas.IP -> ip;
            case AuditSchemas.USER_ID -> userId;
            case AuditSchemas.USER_TYPE -> userType;
            case AuditSchemas.USER_INTERNAL_ID -> userInternalId;
            case AuditSchemas.RESOURCE -> resource;
            case AuditSchemas.RESOURCE_TYPE -> resourceType;
            case AuditSchemas.RESOURCE_ID -> resourceId;
            case AuditSchemas.RESOURCE_PARENT -> resourceParent;
            case AuditSchemas.RESOURCE_INTERNAL_ID -> resourceInternalId;
            case AuditSchemas.LOCATION -> location;
            case AuditSchemas.COUNTRY -> country;
            case AuditSchemas.HOSTNAME -> hostname;
            case AuditSchemas.PROJECT_ID -> projectId;
            case AuditSchemas.PROJECT_INTERNAL_ID -> projectInternalId;
            case AuditSchemas.TEAM_ID -> teamId;
            case AuditSchemas.TEAM_INTERNAL_ID -> teamInternalId;
            case AuditSchemas.TIME -> time;
            case AuditSchemas.DATA -> data;
            case AuditSchemas.TENANT -> tenant;
            default -> data.get(name);
        };
    }

    /**
     * Builds a log from decoded column values. Names without a dedicated component are added to {@code data}.
     */
    public static Log fromAttributes(Map<String, Object> attributes) {
        LogBuilder builder = Log.builder();
        Map<String, Object> data = new LinkedHashMap<>();
        Object decodedData = attributes.get(AuditSchemas.DATA);
        if (decodedData instanceof Map<?, ?> map) {
            map.forEach((key, value) -> data.put(String.valueOf(key), value));
        }
        attributes.forEach((name, value) -> {
            switch (name) {
                case AuditSchemas.ID -> builder.id(asString(value));
                case AuditSchemas.EVENT -> builder.event(asString(value));
                case AuditSchemas.USER_AGENT -> builder.userAgent(asString(value));
                case AuditSchemas.IP -> builder.ip(asString(value));
                case AuditSchemas.USER_ID -> builder.userId(asString(value));
                case AuditSchemas.USER_TYPE -> builder.userType(asString(value));
                case AuditSchemas.USER_INTERNAL_ID -> builder.userInternalId(asString(value));
                case AuditSchemas.RESOURCE -> builder.resource(asString(value));
                case AuditSchemas.RESOURCE_TYPE -> builder.resourceType(asString(value));
                case AuditSchemas.RESOURCE_ID -> builder.resourceId(asString(value));
                case AuditSchemas.RESOURCE_PARENT -> builder.resourceParent(asString(value));
                case AuditSchemas.RESOURCE_INTERNAL_ID -> builder.resourceInternalId(asString(value));
                case AuditSchemas.LOCATION -> builder.location(asString(value));
                case AuditSchemas.COUNTRY -> builder.country(asString(value));
                case AuditSchemas.HOSTNAME -> builder.hostname(asString(value));
                case AuditSchemas.PROJECT_ID -> builder.projectId(asString(value));
                case AuditSchemas.PROJECT_INTERNAL_ID -> builder.projectInternalId(asString(value));
                case AuditSchemas.TEAM_ID -> builder.teamId(asString(value));
                case AuditSchemas.TEAM_INTERNAL_ID -> builder.teamInternalId(asString(value));
                case AuditSchemas.TIME -> builder.time((Instant) value);
                case AuditSchemas.TENANT -> builder.tenant((Long) value);
                case AuditSchemas.DATA -> {
                    // merged above
                }
                default -> {
                    if (value != null) {
                        data.put(name, value);
                    }
                }
            }
        });
        return builder.data(data).build();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
