package tech.yump.audit.adapter;

/**
 * A log or query carries a value that cannot be written as JSON.
 */
public class InvalidLogDataException extends AuditException {

    public InvalidLogDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
