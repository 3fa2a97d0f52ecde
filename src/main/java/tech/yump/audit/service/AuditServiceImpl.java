package tech.yump.audit.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.audit.adapter.AuditAdapter;
import tech.yump.audit.adapter.LogFilter;
import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuditServiceImpl implements AuditService {

    private final AuditAdapter adapter;

    @Override
    public Log log(Log entry) {
        Objects.requireNonNull(entry, "log");
        Log stored = adapter.create(entry);
        log.debug("Service layer: Recorded '{}' audit log {}", stored.event(), stored.id());
        return stored;
    }

    @Override
    public List<Log> logBatch(List<Log> logs) {
        List<Log> stored = adapter.createBatch(logs == null ? List.of() : logs);
        log.debug("Service layer: Recorded batch of {} audit logs", stored.size());
        return stored;
    }

    @Override
    public Optional<Log> getLogById(String id) {
        return adapter.getById(id);
    }

    @Override
    public List<Log> getLogsByUser(String userId, LogFilter filter) {
        return adapter.getByUser(userId, filterOrDefault(filter));
    }

    @Override
    public long countLogsByUser(String userId, LogFilter filter) {
        return adapter.countByUser(userId, filterOrDefault(filter));
    }

    @Override
    public List<Log> getLogsByResource(String resource, LogFilter filter) {
        return adapter.getByResource(resource, filterOrDefault(filter));
    }

    @Override
    public long countLogsByResource(String resource, LogFilter filter) {
        return adapter.countByResource(resource, filterOrDefault(filter));
    }

    @Override
    public List<Log> getLogsByUserAndEvents(String userId, List<String> events, LogFilter filter) {
        return adapter.getByUserAndEvents(userId, events, filterOrDefault(filter));
    }

    @Override
    public long countLogsByUserAndEvents(String userId, List<String> events, LogFilter filter) {
        return adapter.countByUserAndEvents(userId, events, filterOrDefault(filter));
    }

    @Override
    public List<Log> getLogsByResourceAndEvents(String resource, List<String> events, LogFilter filter) {
        return adapter.getByResourceAndEvents(resource, events, filterOrDefault(filter));
    }

    @Override
    public long countLogsByResourceAndEvents(String resource, List<String> events, LogFilter filter) {
        return adapter.countByResourceAndEvents(resource, events, filterOrDefault(filter));
    }

    @Override
    public List<Log> find(List<Query> queries) {
        return adapter.find(queries == null ? List.of() : queries);
    }

    @Override
    public long count(List<Query> queries) {
        return adapter.count(queries == null ? List.of() : queries);
    }

    @Override
    public boolean cleanup(Instant threshold) {
        Objects.requireNonNull(threshold, "threshold");
        log.info("Service layer: Cleaning up audit logs older than {}", threshold);
        return adapter.cleanup(threshold);
    }

    @Override
    public void setup() {
        log.info("Service layer: Setting up {} audit storage", adapter.getName());
        adapter.setup();
    }

    private LogFilter filterOrDefault(LogFilter filter) {
        return filter == null ? LogFilter.defaults() : filter;
    }
}
