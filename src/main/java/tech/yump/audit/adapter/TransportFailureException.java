package tech.yump.audit.adapter;

import lombok.Getter;

/**
 * The engine could not be reached or answered with a non-2xx status.
 * {@link #getResponseBody()} holds the engine's error text when there was a response.
 */
@Getter
public class TransportFailureException extends AuditException {

    private final int statusCode;
    private final String responseBody;

    public TransportFailureException(int statusCode, String responseBody) {
        super("ClickHouse query failed with HTTP " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }
}
