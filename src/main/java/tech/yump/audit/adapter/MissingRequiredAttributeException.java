package tech.yump.audit.adapter;

import lombok.Getter;

@Getter
public class MissingRequiredAttributeException extends AuditException {

    private final String attribute;

    public MissingRequiredAttributeException(String attribute) {
        super("Required attribute '" + attribute + "' is missing");
        this.attribute = attribute;
    }

    public MissingRequiredAttributeException(String attribute, int row) {
        super("Required attribute '" + attribute + "' is missing in batch log entry " + row);
        this.attribute = attribute;
    }
}
