package tech.yump.audit.adapter;

import lombok.Getter;

/**
 * A query or insert referenced an attribute name that the schema does not declare.
 */
@Getter
public class UnknownAttributeException extends AuditException {

    private final String attribute;

    public UnknownAttributeException(String attribute) {
        super("Invalid attribute name: " + attribute);
        this.attribute = attribute;
    }
}
