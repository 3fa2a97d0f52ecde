package tech.yump.audit.schema;

import java.util.List;

/**
 * A list of attributes and the indexes over them, either the base set or an extension attached to it.
 */
public record SchemaPart(List<AttributeDescriptor> attributes, List<IndexDescriptor> indexes) {

    public SchemaPart {
        attributes = List.copyOf(attributes);
        indexes = List.copyOf(indexes);
    }
}
