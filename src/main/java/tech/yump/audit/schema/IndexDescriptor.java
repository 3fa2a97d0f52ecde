package tech.yump.audit.schema;

import tech.yump.audit.adapter.InvalidConfigurationException;

import java.util.List;

/**
 * A secondary index hint. Only used when the table is created.
 */
public record IndexDescriptor(String name, List<String> attributes) {

    public IndexDescriptor {
        if (name == null || !AttributeDescriptor.NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidConfigurationException("Invalid index name: " + name);
        }
        if (attributes == null || attributes.isEmpty()) {
            throw new InvalidConfigurationException("Index '" + name + "' must reference at least one attribute");
        }
        attributes = List.copyOf(attributes);
    }

    public static IndexDescriptor of(String name, String... attributes) {
        return new IndexDescriptor(name, List.of(attributes));
    }
}
