package tech.yump.audit.adapter;

/**
 * Base exception for every failure raised by an {@link AuditAdapter} implementation.
 */
public class AuditException extends RuntimeException {

    public AuditException(String message) {
        super(message);
    }

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
