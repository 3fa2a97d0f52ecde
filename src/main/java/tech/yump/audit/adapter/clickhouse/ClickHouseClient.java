package tech.yump.audit.adapter.clickhouse;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import tech.yump.audit.adapter.TransportFailureException;
import tech.yump.audit.adapter.TransportTimeoutException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Sends SQL statements to the engine's HTTP interface.
 * <p>
 * The statement travels in the {@code query} form field and every bound value in its own
 * {@code param_<name>} field, so values never become part of the SQL text. Credentials are sent as
 * {@code X-ClickHouse-User}/{@code X-ClickHouse-Key} headers and the active database as
 * {@code X-ClickHouse-Database}. One instance is shared by all calls.
 */
@Slf4j
public class ClickHouseClient {

    static final String NULL_MARKER = "\\N";

    private final RestClient restClient;
    private final ClickHouseSettings settings;

    public ClickHouseClient(RestClient.Builder builder, ClickHouseSettings settings) {
        this.settings = settings;
        this.restClient = builder
                .baseUrl(settings.baseUrl())
                .defaultHeader("X-ClickHouse-User", settings.username())
                .defaultHeader("X-ClickHouse-Key", settings.password())
                .build();
        log.info("ClickHouse client configured: {}", settings);
    }

    /**
     * Request factory enforcing the configured timeout on connect and read.
     */
    public static SimpleClientHttpRequestFactory requestFactory(ClickHouseSettings settings) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = Math.toIntExact(settings.timeout().toMillis());
        factory.setConnectTimeout(timeoutMillis);
        factory.setReadTimeout(timeoutMillis);
        return factory;
    }

    public ClickHouseSettings settings() {
        return settings;
    }

    /**
     * Executes a statement against {@code database} and returns the raw response body.
     *
     * @param database active database, or {@code null} to use the server default
     * @throws TransportFailureException when the engine is unreachable or answers with a non-2xx status
     * @throws TransportTimeoutException when the configured timeout elapses
     */
    public String query(String database, String sql, Map<String, ?> params) {
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("query", sql);
        params.forEach((name, value) -> form.add("param_" + name, formatParam(value)));

        log.trace("ClickHouse SQL: {}", sql);

        try {
            ResponseEntity<byte[]> response = restClient.post()
                    .uri(uriBuilder -> {
                        if (settings.compression() != Compression.NONE) {
                            uriBuilder.queryParam("enable_http_compression", 1);
                        }
                        return uriBuilder.build();
                    })
                    .headers(headers -> {
                        if (database != null) {
                            headers.set("X-ClickHouse-Database", database);
                        }
                        if (settings.compression() != Compression.NONE) {
                            headers.set(HttpHeaders.ACCEPT_ENCODING, settings.compression().encoding());
                        }
                    })
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .toEntity(byte[].class);
            return decodeBody(response);
        } catch (RestClientResponseException e) {
            String body = e.getResponseBodyAsString();
            log.warn("ClickHouse responded with HTTP {}: {}", e.getStatusCode().value(), body);
            throw new TransportFailureException(e.getStatusCode().value(), body);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                log.warn("ClickHouse request timed out after {}", settings.timeout());
                throw new TransportTimeoutException(
                        "ClickHouse request timed out after " + settings.timeout().toMillis() + " ms", e);
            }
            log.error("ClickHouse request failed: {}", e.getMessage());
            throw new TransportFailureException("ClickHouse query execution failed: " + e.getMessage(), e);
        }
    }

    /**
     * Renders a bound value in the escaped text form the engine reads {@code param_*} fields in.
     * Only {@code null} becomes the bare {@code \N} marker.
     */
    static String formatParam(Object value) {
        if (value == null) {
            return NULL_MARKER;
        }
        if (value instanceof Boolean bool) {
            return bool ? "1" : "0";
        }
        if (value instanceof Instant instant) {
            return ClickHouseTimestamps.format(instant);
        }
        return escape(String.valueOf(value));
    }

    static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\t' -> out.append("\\t");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\0' -> out.append("\\0");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    private String decodeBody(ResponseEntity<byte[]> response) {
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            return "";
        }
        String encoding = response.getHeaders().getFirst(HttpHeaders.CONTENT_ENCODING);
        if (encoding == null || encoding.isBlank() || "identity".equalsIgnoreCase(encoding)) {
            return new String(body, StandardCharsets.UTF_8);
        }
        try (InputStream in = inflate(encoding.trim(), new ByteArrayInputStream(body))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to decompress {} ClickHouse response", encoding);
            throw new TransportFailureException("Failed to decompress ClickHouse response: " + e.getMessage(), e);
        }
    }

    private InputStream inflate(String encoding, InputStream body) throws IOException {
        if ("gzip".equalsIgnoreCase(encoding)) {
            return new GZIPInputStream(body);
        }
        if ("deflate".equalsIgnoreCase(encoding)) {
            return new InflaterInputStream(body);
        }
        throw new IOException("unsupported content encoding " + encoding);
    }

    private boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
