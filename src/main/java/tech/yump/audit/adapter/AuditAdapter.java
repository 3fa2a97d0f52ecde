package tech.yump.audit.adapter;

import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Contract shared by every audit log storage backend.
 * <p>
 * Implementations are append-only: logs are created, read, and removed in bulk by {@link #cleanup(Instant)}.
 * A log created immediately before a read is not guaranteed to be visible to it when the backend replicates
 * asynchronously.
 */
public interface AuditAdapter {

    /**
     * Human-readable backend name.
     */
    String getName();

    /**
     * Creates the backing storage when absent. Safe to call repeatedly, never alters existing storage.
     */
    void setup();

    /**
     * Stores one log and returns it with its newly assigned id.
     */
    Log create(Log log);

    /**
     * Stores all logs in one statement. Either every log is stored or none is.
     */
    List<Log> createBatch(List<Log> logs);

    Optional<Log> getById(String id);

    List<Log> find(List<Query> queries);

    long count(List<Query> queries);

    /**
     * Removes every log whose time is strictly before {@code threshold}.
     *
     * @return {@code true} once the removal has been accepted by the backend
     */
    boolean cleanup(Instant threshold);

    List<Log> getByUser(String userId, LogFilter filter);

    long countByUser(String userId, LogFilter filter);

    List<Log> getByResource(String resource, LogFilter filter);

    long countByResource(String resource, LogFilter filter);

    List<Log> getByUserAndEvents(String userId, List<String> events, LogFilter filter);

    long countByUserAndEvents(String userId, List<String> events, LogFilter filter);

    List<Log> getByResourceAndEvents(String resource, List<String> events, LogFilter filter);

    long countByResourceAndEvents(String resource, List<String> events, LogFilter filter);
}
