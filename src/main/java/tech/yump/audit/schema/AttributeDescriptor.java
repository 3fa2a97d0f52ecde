package tech.yump.audit.schema;

import tech.yump.audit.adapter.InvalidConfigurationException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A typed column of the audit table.
 *
 * @param name     column name, unique within a schema
 * @param kind     storage kind
 * @param maxSize  declared maximum length (0 when not applicable)
 * @param required whether an insert must supply a value
 */
public record AttributeDescriptor(String name, AttributeKind kind, int maxSize, boolean required) {

    static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public AttributeDescriptor {
        Objects.requireNonNull(kind, "kind");
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidConfigurationException("Invalid attribute name: " + name);
        }
        if (maxSize < 0) {
            throw new InvalidConfigurationException("Attribute '" + name + "' has a negative size");
        }
    }

    public static AttributeDescriptor text(String name, int maxSize, boolean required) {
        return new AttributeDescriptor(name, AttributeKind.TEXT, maxSize, required);
    }

    public static AttributeDescriptor datetime(String name, boolean required) {
        return new AttributeDescriptor(name, AttributeKind.DATETIME, 0, required);
    }

    public static AttributeDescriptor json(String name, int maxSize) {
        return new AttributeDescriptor(name, AttributeKind.JSON, maxSize, false);
    }
}
