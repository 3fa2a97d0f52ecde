package tech.yump.audit.adapter;

import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;
import tech.yump.audit.schema.AuditSchemas;

import java.util.ArrayList;
import java.util.List;

/**
 * Implements the convenience lookups of {@link AuditAdapter} by assembling the equivalent query list and
 * delegating to {@link #find(List)} and {@link #count(List)}.
 */
public abstract class AbstractAuditAdapter implements AuditAdapter {

    @Override
    public List<Log> getByUser(String userId, LogFilter filter) {
        return find(buildQueries(Query.equal(AuditSchemas.USER_ID, userId), null, filter, true));
    }

    @Override
    public long countByUser(String userId, LogFilter filter) {
        return count(buildQueries(Query.equal(AuditSchemas.USER_ID, userId), null, filter, false));
    }

    @Override
    public List<Log> getByResource(String resource, LogFilter filter) {
        return find(buildQueries(Query.equal(AuditSchemas.RESOURCE, resource), null, filter, true));
    }

    @Override
    public long countByResource(String resource, LogFilter filter) {
        return count(buildQueries(Query.equal(AuditSchemas.RESOURCE, resource), null, filter, false));
    }

    @Override
    public List<Log> getByUserAndEvents(String userId, List<String> events, LogFilter filter) {
        return find(buildQueries(Query.equal(AuditSchemas.USER_ID, userId), events, filter, true));
    }

    @Override
    public long countByUserAndEvents(String userId, List<String> events, LogFilter filter) {
        return count(buildQueries(Query.equal(AuditSchemas.USER_ID, userId), events, filter, false));
    }

    @Override
    public List<Log> getByResourceAndEvents(String resource, List<String> events, LogFilter filter) {
        return find(buildQueries(Query.equal(AuditSchemas.RESOURCE, resource), events, filter, true));
    }

    @Override
    public long countByResourceAndEvents(String resource, List<String> events, LogFilter filter) {
        return count(buildQueries(Query.equal(AuditSchemas.RESOURCE, resource), events, filter, false));
    }

    protected List<Query> buildQueries(Query subject, List<String> events, LogFilter filter, boolean paged) {
        LogFilter effective = filter == null ? LogFilter.defaults() : filter;
        List<Query> queries = new ArrayList<>();
        queries.add(subject);

        if (events != null && !events.isEmpty()) {
            queries.add(Query.in(AuditSchemas.EVENT, events));
        }

        if (effective.after() != null && effective.before() != null) {
            queries.add(Query.between(AuditSchemas.TIME, effective.after(), effective.before()));
        } else if (effective.after() != null) {
            queries.add(Query.greaterThan(AuditSchemas.TIME, effective.after()));
        } else if (effective.before() != null) {
            queries.add(Query.lessThan(AuditSchemas.TIME, effective.before()));
        }

        if (paged) {
            if (effective.ascending()) {
                queries.add(Query.orderAsc(AuditSchemas.TIME));
                queries.add(Query.orderAsc(AuditSchemas.ID));
            } else {
                queries.add(Query.orderDesc(AuditSchemas.TIME));
                queries.add(Query.orderDesc(AuditSchemas.ID));
            }
            queries.add(Query.limit(effective.limit()));
            queries.add(Query.offset(effective.offset()));
        }
        return queries;
    }
}
