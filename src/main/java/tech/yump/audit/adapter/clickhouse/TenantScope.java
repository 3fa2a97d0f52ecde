package tech.yump.audit.adapter.clickhouse;

/**
 * Tenancy mode of the table: whether it carries a {@code tenant} column and which tenant the adapter acts for.
 * Statements are tenant-filtered only when both are set.
 */
record TenantScope(boolean sharedTables, Long tenant) {

    static final TenantScope NONE = new TenantScope(false, null);

    boolean filtering() {
        return sharedTables && tenant != null;
    }
}
