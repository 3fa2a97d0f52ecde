package tech.yump.audit.adapter;

/**
 * A malformed query value: an unknown method, the wrong number of values for a method,
 * or a value that cannot be bound for its attribute (negative limit, unparsable datetime).
 */
public class UnsupportedMethodException extends AuditException {

    public UnsupportedMethodException(String message) {
        super(message);
    }

    public UnsupportedMethodException(String message, Throwable cause) {
        super(message, cause);
    }
}
