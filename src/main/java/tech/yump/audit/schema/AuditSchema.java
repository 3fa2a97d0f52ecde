package tech.yump.audit.schema;

import tech.yump.audit.adapter.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, flattened registry of the attributes and indexes an adapter persists.
 * <p>
 * Built by concatenating a base {@link SchemaPart} with zero or more extensions. Registration order is kept
 * and is the column order used for DDL, inserts and decoding. A name declared twice is rejected,
 * never shadowed.
 */
public final class AuditSchema {

    private final Map<String, AttributeDescriptor> attributes;
    private final List<IndexDescriptor> indexes;

    private AuditSchema(Map<String, AttributeDescriptor> attributes, List<IndexDescriptor> indexes) {
        this.attributes = Collections.unmodifiableMap(attributes);
        this.indexes = List.copyOf(indexes);
    }

    public static AuditSchema compose(SchemaPart base, SchemaPart... extensions) {
        List<SchemaPart> parts = new ArrayList<>();
        parts.add(base);
        parts.addAll(List.of(extensions));
        return compose(parts);
    }

    public static AuditSchema compose(List<SchemaPart> parts) {
        Map<String, AttributeDescriptor> attributes = new LinkedHashMap<>();
        List<IndexDescriptor> indexes = new ArrayList<>();
        for (SchemaPart part : parts) {
            for (AttributeDescriptor attribute : part.attributes()) {
                if (AuditSchemas.ID.equals(attribute.name()) || AuditSchemas.TENANT.equals(attribute.name())) {
                    throw new InvalidConfigurationException("Attribute name '" + attribute.name() + "' is reserved");
                }
                if (attributes.putIfAbsent(attribute.name(), attribute) != null) {
                    throw new InvalidConfigurationException("Duplicate attribute: " + attribute.name());
                }
            }
        }
        for (SchemaPart part : parts) {
            for (IndexDescriptor index : part.indexes()) {
                if (indexes.stream().anyMatch(existing -> existing.name().equals(index.name()))) {
                    throw new InvalidConfigurationException("Duplicate index: " + index.name());
                }
                for (String attribute : index.attributes()) {
                    if (!attributes.containsKey(attribute)) {
                        throw new InvalidConfigurationException(
                                "Index '" + index.name() + "' references undeclared attribute '" + attribute + "'");
                    }
                }
                indexes.add(index);
            }
        }
        return new AuditSchema(attributes, indexes);
    }

    public List<AttributeDescriptor> attributes() {
        return List.copyOf(attributes.values());
    }

    public List<IndexDescriptor> indexes() {
        return indexes;
    }

    public Optional<AttributeDescriptor> lookup(String name) {
        return Optional.ofNullable(name).map(attributes::get);
    }

    public boolean contains(String name) {
        return name != null && attributes.containsKey(name);
    }
}
