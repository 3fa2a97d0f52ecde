package tech.yump.audit.service;

import tech.yump.audit.adapter.LogFilter;
import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer interface for recording and reading audit logs through the configured adapter.
 * Lookups without an explicit {@link LogFilter} return the 25 newest logs.
 */
public interface AuditService {

    /**
     * Records a single audit log.
     *
     * @param log The log to store. {@code event}, {@code userAgent} and {@code ip} are required.
     * @return The stored log, with its assigned id and time.
     * @throws tech.yump.audit.adapter.MissingRequiredAttributeException If a required attribute is missing.
     * @throws tech.yump.audit.adapter.TransportFailureException If the backend rejects the insert.
     */
    Log log(Log log);

    /**
     * Records all logs in one statement; nothing is stored when any of them is invalid.
     */
    List<Log> logBatch(List<Log> logs);

    Optional<Log> getLogById(String id);

    List<Log> getLogsByUser(String userId, LogFilter filter);

    long countLogsByUser(String userId, LogFilter filter);

    List<Log> getLogsByResource(String resource, LogFilter filter);

    long countLogsByResource(String resource, LogFilter filter);

    List<Log> getLogsByUserAndEvents(String userId, List<String> events, LogFilter filter);

    long countLogsByUserAndEvents(String userId, List<String> events, LogFilter filter);

    List<Log> getLogsByResourceAndEvents(String resource, List<String> events, LogFilter filter);

    long countLogsByResourceAndEvents(String resource, List<String> events, LogFilter filter);

    List<Log> find(List<Query> queries);

    long count(List<Query> queries);

    /**
     * Deletes every log older than {@code threshold}. Deletion may take effect asynchronously.
     */
    boolean cleanup(Instant threshold);

    /**
     * Creates the backing storage when absent.
     */
    void setup();

    default List<Log> getLogsByUser(String userId) {
        return getLogsByUser(userId, LogFilter.defaults());
    }

    default long countLogsByUser(String userId) {
        return countLogsByUser(userId, LogFilter.defaults());
    }

    default List<Log> getLogsByResource(String resource) {
        return getLogsByResource(resource, LogFilter.defaults());
    }

    default long countLogsByResource(String resource) {
        return countLogsByResource(resource, LogFilter.defaults());
    }

    default List<Log> getLogsByUserAndEvents(String userId, List<String> events) {
        return getLogsByUserAndEvents(userId, events, LogFilter.defaults());
    }

    default long countLogsByUserAndEvents(String userId, List<String> events) {
        return countLogsByUserAndEvents(userId, events, LogFilter.defaults());
    }

    default List<Log> getLogsByResourceAndEvents(String resource, List<String> events) {
        return getLogsByResourceAndEvents(resource, events, LogFilter.defaults());
    }

    default long countLogsByResourceAndEvents(String resource, List<String> events) {
        return countLogsByResourceAndEvents(resource, events, LogFilter.defaults());
    }
}
