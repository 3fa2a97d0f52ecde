package tech.yump.audit.adapter.clickhouse;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.audit.adapter.CorruptRowException;
import tech.yump.audit.adapter.InvalidConfigurationException;
import tech.yump.audit.adapter.LogFilter;
import tech.yump.audit.adapter.MissingRequiredAttributeException;
import tech.yump.audit.adapter.UnknownAttributeException;
import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;
import tech.yump.audit.schema.AuditSchemas;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClickHouseAdapterTest {

    private static final String DATABASE = "audit_db";
    private static final String TABLE = "`audit_db`.`proj_audits`";

    @Mock
    private ClickHouseClient mockClient;

    @Captor
    private ArgumentCaptor<String> sqlCaptor;

    @Captor
    private ArgumentCaptor<Map<String, Object>> paramsCaptor;

    private ClickHouseAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new ClickHouseAdapter(mockClient, AuditSchemas.full(), new ObjectMapper())
                .setDatabase(DATABASE)
                .setNamespace("proj");
    }

    private Log validLog() {
        return Log.builder()
                .event("document.update")
                .userAgent("Mozilla/5.0")
                .ip("10.0.0.1")
                .userId("u1")
                .resource("doc/1")
                .build();
    }

    // --- configuration ---

    @Test
    @DisplayName("getName returns ClickHouse")
    void getName() {
        assertThat(adapter.getName()).isEqualTo("ClickHouse");
    }

    @Test
    @DisplayName("identifiers are validated when assigned")
    void setters_validateIdentifiers() {
        assertThatThrownBy(() -> adapter.setDatabase(""))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Database cannot be empty");
        assertThatThrownBy(() -> adapter.setDatabase("drop"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Database cannot be a reserved SQL keyword");
        assertThatThrownBy(() -> adapter.setNamespace("proj`; DROP TABLE x"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageStartingWith("Namespace must start with a letter or underscore");
        assertThatThrownBy(() -> adapter.setDatabase("a".repeat(256)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Database cannot exceed 255 characters");
        assertThatThrownBy(() -> adapter.setTenant(-1L))
                .isInstanceOf(InvalidConfigurationException.class);
        verifyNoInteractions(mockClient);
    }

    @Test
    @DisplayName("an empty namespace means the unprefixed table")
    void tableName_withoutNamespace() {
        assertThat(adapter.tableName()).isEqualTo("proj_audits");
        assertThatCode(() -> adapter.setNamespace("")).doesNotThrowAnyException();
        assertThat(adapter.tableName()).isEqualTo("audits");
    }

    // --- setup ---

    @Test
    @DisplayName("setup creates the database, then a MergeTree table from the schema")
    void setup_createsDatabaseAndTable() {
        adapter.setSharedTables(true);

        adapter.setup();

        verify(mockClient).query(isNull(), eq("CREATE DATABASE IF NOT EXISTS `audit_db`"), eq(Map.of()));
        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), eq(Map.of()));
        assertThat(sqlCaptor.getValue())
                .startsWith("CREATE TABLE IF NOT EXISTS " + TABLE + " (`id` String, `userId` Nullable(String), `event` String")
                .contains("`time` DateTime64(3)")
                .contains("`data` Nullable(String)")
                .contains("`tenant` Nullable(UInt64)")
                .contains("INDEX `idx_userId_event` (`userId`, `event`) TYPE bloom_filter GRANULARITY 1")
                .contains("INDEX `_key_hostname` (`hostname`) TYPE bloom_filter GRANULARITY 1")
                .endsWith("ENGINE = MergeTree() ORDER BY (`time`, `id`) PARTITION BY toYYYYMM(`time`) SETTINGS index_granularity = 8192");
    }

    // --- create ---

    @Test
    @DisplayName("create mints an id, defaults the time and issues one INSERT")
    void create_insertsOneRow() {
        Instant before = Instant.now().minusSeconds(1);

        Log stored = adapter.create(validLog());

        assertThat(UUID.fromString(stored.id())).isNotNull();
        assertThat(stored.time()).isAfter(before);
        assertThat(stored.resourceType()).isEqualTo("doc");
        assertThat(stored.resourceId()).isEqualTo("1");
        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), paramsCaptor.capture());
        assertThat(sqlCaptor.getValue()).startsWith("INSERT INTO " + TABLE + " (`id`, `userId`, `event`, `resource`");
        assertThat(paramsCaptor.getValue()).containsEntry("id_0", stored.id()).containsEntry("event_0", "document.update");
    }

    @Test
    @DisplayName("each created log gets a distinct id, caller ids are ignored")
    void createBatch_mintsIds() {
        List<Log> stored = adapter.createBatch(List.of(validLog().toBuilder().id("caller").build(), validLog()));

        assertThat(stored).hasSize(2);
        assertThat(stored).extracting(Log::id).doesNotContain("caller").doesNotHaveDuplicates();
        verify(mockClient, times(1)).query(eq(DATABASE), sqlCaptor.capture(), anyMap());
        assertThat(sqlCaptor.getValue()).contains("({id_0:String}").contains("({id_1:String}");
    }

    @Test
    @DisplayName("an empty batch makes no call")
    void createBatch_empty() {
        assertThat(adapter.createBatch(List.of())).isEmpty();
        verifyNoInteractions(mockClient);
    }

    @Test
    @DisplayName("a missing required attribute is rejected before any network call")
    void create_missingRequired_noNetwork() {
        assertThatThrownBy(() -> adapter.create(validLog().toBuilder().userAgent(null).build()))
                .isInstanceOf(MissingRequiredAttributeException.class);
        assertThatThrownBy(() -> adapter.createBatch(List.of(validLog(), validLog().toBuilder().event(null).build())))
                .isInstanceOf(MissingRequiredAttributeException.class);
        verifyNoInteractions(mockClient);
    }

    // --- reads ---

    @Test
    @DisplayName("getById selects one row and decodes it")
    void getById_found() {
        String row = "abc\tu1\tdocument.update\tdoc/1\tua\t10.0.0.1\t\\N\t2024-01-01 00:00:00.000"
                + "\t\\N\t\\N\t\\N\tdoc\t1\t\\N\t\\N\t\\N\t\\N\t\\N\t\\N\t\\N\t{}\n";
        when(mockClient.query(eq(DATABASE), anyString(), anyMap())).thenReturn(row);

        Optional<Log> found = adapter.getById("abc");

        assertThat(found).get().extracting(Log::id, Log::resourceType).containsExactly("abc", "doc");
        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), paramsCaptor.capture());
        assertThat(sqlCaptor.getValue())
                .startsWith("SELECT `id`, `userId`")
                .contains("FROM " + TABLE + " WHERE `id` = {id:String} LIMIT 1 FORMAT TabSeparated");
        assertThat(paramsCaptor.getValue()).containsExactly(Map.entry("id", "abc"));
    }

    @Test
    @DisplayName("getById is empty when no row matches")
    void getById_notFound() {
        when(mockClient.query(eq(DATABASE), anyString(), anyMap())).thenReturn("");

        assertThat(adapter.getById("missing")).isEmpty();
    }

    @Test
    @DisplayName("getById is restricted to the tenant on shared tables")
    void getById_tenantScoped() {
        adapter.setSharedTables(true).setTenant(5L);
        when(mockClient.query(eq(DATABASE), anyString(), anyMap())).thenReturn("");

        adapter.getById("abc");

        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), paramsCaptor.capture());
        assertThat(sqlCaptor.getValue()).contains("WHERE `id` = {id:String} AND `tenant` = {tenant:UInt64} LIMIT 1");
        assertThat(sqlCaptor.getValue()).contains("`data`, `tenant` FROM");
        assertThat(paramsCaptor.getValue()).containsEntry("tenant", 5L);
    }

    @Test
    @DisplayName("find with an unknown attribute never reaches the client")
    void find_unknownAttribute_noNetwork() {
        assertThatThrownBy(() -> adapter.find(List.of(Query.equal("password", "x"))))
                .isInstanceOf(UnknownAttributeException.class);
        assertThatThrownBy(() -> adapter.count(List.of(Query.orderDesc("1; DROP"))))
                .isInstanceOf(UnknownAttributeException.class);
        verifyNoInteractions(mockClient);
    }

    @Test
    @DisplayName("getByUserAndEvents assembles the equivalent query with default paging newest first")
    void getByUserAndEvents_defaults() {
        when(mockClient.query(eq(DATABASE), anyString(), anyMap())).thenReturn("");

        adapter.getByUserAndEvents("u1", List.of("update", "delete"), LogFilter.defaults());

        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), paramsCaptor.capture());
        assertThat(sqlCaptor.getValue()).endsWith(" FROM " + TABLE
                + " WHERE `userId` = {param0:String} AND `event` IN ({param1:String}, {param2:String})"
                + " ORDER BY `time` DESC, `id` DESC LIMIT {limit:UInt64} OFFSET {offset:UInt64} FORMAT TabSeparated");
        assertThat(paramsCaptor.getValue())
                .containsEntry("param0", "u1")
                .containsEntry("limit", 25L)
                .containsEntry("offset", 0L);
    }

    @Test
    @DisplayName("countByResource uses the time range but no ordering or paging")
    void countByResource_withRange() {
        when(mockClient.query(eq(DATABASE), anyString(), anyMap())).thenReturn("2\n");
        LogFilter filter = LogFilter.defaults().between(
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"));

        long count = adapter.countByResource("doc/2", filter);

        assertThat(count).isEqualTo(2);
        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), paramsCaptor.capture());
        assertThat(sqlCaptor.getValue()).isEqualTo("SELECT count() FROM " + TABLE
                + " WHERE `resource` = {param0:String} AND `time` BETWEEN {param1:DateTime64(3)} AND {param2:DateTime64(3)}"
                + " FORMAT TabSeparated");
        assertThat(paramsCaptor.getValue()).doesNotContainKeys("limit", "offset");
    }

    @Test
    @DisplayName("count reads the single result row, a missing or non-numeric row is corrupt")
    void count_parsesBody() {
        when(mockClient.query(eq(DATABASE), anyString(), anyMap())).thenReturn("0\n", "", "garbage");

        assertThat(adapter.count(List.of())).isZero();
        assertThatThrownBy(() -> adapter.count(List.of()))
                .isInstanceOf(CorruptRowException.class)
                .hasMessage("Count query returned no result row");
        assertThatThrownBy(() -> adapter.count(List.of()))
                .isInstanceOf(CorruptRowException.class);
    }

    // --- cleanup ---

    @Test
    @DisplayName("cleanup deletes rows strictly older than the threshold")
    void cleanup() {
        adapter.setSharedTables(true).setTenant(3L);

        boolean accepted = adapter.cleanup(Instant.parse("2024-06-30T23:59:59.999Z"));

        assertThat(accepted).isTrue();
        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), paramsCaptor.capture());
        assertThat(sqlCaptor.getValue()).isEqualTo("DELETE FROM " + TABLE
                + " WHERE `time` < {datetime:DateTime64(3)} AND `tenant` = {tenant:UInt64}");
        assertThat(paramsCaptor.getValue())
                .containsEntry("datetime", "2024-06-30 23:59:59.999")
                .containsEntry("tenant", 3L);
    }

    @Test
    @DisplayName("find passes every query through the translator")
    void find_delegates() {
        when(mockClient.query(any(), anyString(), anyMap())).thenReturn("");

        assertThat(adapter.find(List.of(Query.equal("country", "PT"), Query.limit(1)))).isEmpty();

        verify(mockClient).query(eq(DATABASE), sqlCaptor.capture(), anyMap());
        assertThat(sqlCaptor.getValue()).contains("WHERE `country` = {param0:String} LIMIT {limit:UInt64}");
    }
}
