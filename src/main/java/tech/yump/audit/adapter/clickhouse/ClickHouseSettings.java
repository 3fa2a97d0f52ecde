package tech.yump.audit.adapter.clickhouse;

import tech.yump.audit.adapter.InvalidConfigurationException;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Connection settings of the engine's HTTP interface, validated on construction.
 */
public record ClickHouseSettings(
        String host,
        int port,
        String username,
        String password,
        boolean secure,
        Duration timeout,
        Compression compression
) {

    public static final int DEFAULT_PORT = 8123;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration MIN_TIMEOUT = Duration.ofMillis(1_000);
    public static final Duration MAX_TIMEOUT = Duration.ofMillis(600_000);

    // RFC 1123 hostname or dotted IPv4
    private static final Pattern HOSTNAME = Pattern.compile(
            "^(?=.{1,253}$)([a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)(\\.([a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?))*$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]*:[0-9a-fA-F:.]*$");

    public ClickHouseSettings {
        if (host == null || !(HOSTNAME.matcher(host).matches() || IPV6.matcher(host).matches())) {
            throw new InvalidConfigurationException("ClickHouse host is not a valid hostname or IP address");
        }
        if (port < 1 || port > 65535) {
            throw new InvalidConfigurationException("ClickHouse port must be between 1 and 65535");
        }
        username = username == null ? "default" : username;
        password = password == null ? "" : password;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.compareTo(MIN_TIMEOUT) < 0 || timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new InvalidConfigurationException("ClickHouse timeout must be between "
                    + MIN_TIMEOUT.toMillis() + " and " + MAX_TIMEOUT.toMillis() + " milliseconds");
        }
        if (compression == null) {
            throw new InvalidConfigurationException("ClickHouse compression mode must be one of NONE, GZIP, DEFLATE");
        }
    }

    public static ClickHouseSettings of(String host, String username, String password) {
        return new ClickHouseSettings(host, DEFAULT_PORT, username, password, false, DEFAULT_TIMEOUT, Compression.NONE);
    }

    public String baseUrl() {
        String scheme = secure ? "https" : "http";
        String authority = host.contains(":") ? "[" + host + "]" : host;
        return scheme + "://" + authority + ":" + port + "/";
    }

    @Override
    public String toString() {
        return "ClickHouseSettings[host=" + host + ", port=" + port + ", username=" + username
                + ", password=****, secure=" + secure + ", timeout=" + timeout + ", compression=" + compression + "]";
    }
}
