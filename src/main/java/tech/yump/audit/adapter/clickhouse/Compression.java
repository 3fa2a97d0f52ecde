package tech.yump.audit.adapter.clickhouse;

/**
 * Response compression requested from the engine.
 */
public enum Compression {
    NONE(null),
    GZIP("gzip"),
    DEFLATE("deflate");

    private final String encoding;

    Compression(String encoding) {
        this.encoding = encoding;
    }

    /**
     * {@code Accept-Encoding} value, {@code null} for {@link #NONE}.
     */
    public String encoding() {
        return encoding;
    }
}
