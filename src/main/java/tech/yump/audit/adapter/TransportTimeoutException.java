package tech.yump.audit.adapter;

public class TransportTimeoutException extends AuditException {

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
