package tech.yump.audit.adapter;

/**
 * Raised for a bad host, port, timeout, compression mode or identifier.
 * Always detected locally, before any request reaches the engine.
 */
public class InvalidConfigurationException extends AuditException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
