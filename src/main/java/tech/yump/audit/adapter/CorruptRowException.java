package tech.yump.audit.adapter;

/**
 * A response row could not be decoded: invalid JSON payload, unparsable timestamp or tenant,
 * or a row with more fields than the selected column list.
 */
public class CorruptRowException extends AuditException {

    public CorruptRowException(String message) {
        super(message);
    }

    public CorruptRowException(String message, Throwable cause) {
        super(message, cause);
    }
}
