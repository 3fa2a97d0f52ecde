package tech.yump.audit.api.v1;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.audit.adapter.InvalidLogDataException;
import tech.yump.audit.adapter.LogFilter;
import tech.yump.audit.adapter.MissingRequiredAttributeException;
import tech.yump.audit.adapter.TransportFailureException;
import tech.yump.audit.adapter.TransportTimeoutException;
import tech.yump.audit.adapter.TruncatedRowException;
import tech.yump.audit.adapter.UnknownAttributeException;
import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;
import tech.yump.audit.query.QueryCodec;
import tech.yump.audit.service.AuditService;

import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuditLogController.class)
@Import(QueryCodec.class)
class AuditLogControllerTest {

    private static final String BASE_URL = "/v1/audit/logs";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AuditService auditService;

    private Log storedLog(String id) {
        return Log.builder()
                .id(id)
                .event("document.update")
                .userAgent("Mozilla/5.0")
                .ip("10.0.0.1")
                .userId("u1")
                .time(Instant.parse("2024-03-01T12:00:00Z"))
                .data(Map.of("changed", "title"))
                .build();
    }

    // --- record ---

    @Test
    @DisplayName("POST records a log and returns it with 201")
    void createLog() throws Exception {
        Log request = Log.builder().event("document.update").userAgent("Mozilla/5.0").ip("10.0.0.1").userId("u1").build();
        when(auditService.log(any(Log.class))).thenReturn(storedLog("a1"));

        mockMvc.perform(post(BASE_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is("a1")))
                .andExpect(jsonPath("$.time", is("2024-03-01T12:00:00Z")))
                .andExpect(jsonPath("$.data.changed", is("title")));
    }

    @Test
    @DisplayName("POST with a missing required attribute answers 400 naming the attribute")
    void createLog_missingAttribute() throws Exception {
        when(auditService.log(any())).thenThrow(new MissingRequiredAttributeException("ip"));

        mockMvc.perform(post(BASE_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event\":\"x\",\"userAgent\":\"ua\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Missing Required Attribute")))
                .andExpect(jsonPath("$.attribute", is("ip")));
    }

    @Test
    @DisplayName("POST with malformed JSON answers 400 without calling the service")
    void createLog_malformedBody() throws Exception {
        mockMvc.perform(post(BASE_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Bad Request")));
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("POST with data that cannot be stored as JSON answers 400")
    void createLog_invalidData() throws Exception {
        when(auditService.log(any(Log.class))).thenThrow(
                new InvalidLogDataException("Log data is not JSON serializable: no serializer", null));

        mockMvc.perform(post(BASE_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event\":\"x\",\"userAgent\":\"ua\",\"ip\":\"1.1.1.1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Bad Request")));
    }

    @Test
    @DisplayName("POST /batch records every log")
    void createLogs() throws Exception {
        when(auditService.logBatch(anyList())).thenReturn(List.of(storedLog("a1"), storedLog("a2")));

        mockMvc.perform(post(BASE_URL + "/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"event\":\"a\",\"userAgent\":\"ua\",\"ip\":\"1.1.1.1\"},"
                                + "{\"event\":\"b\",\"userAgent\":\"ua\",\"ip\":\"1.1.1.1\"}]"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].id", is("a2")));
    }

    // --- read ---

    @Test
    @DisplayName("GET by id returns the log or 404")
    void getLog() throws Exception {
        when(auditService.getLogById("a1")).thenReturn(Optional.of(storedLog("a1")));
        when(auditService.getLogById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get(BASE_URL + "/a1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event", is("document.update")));
        mockMvc.perform(get(BASE_URL + "/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message", is("Audit log not found: nope")));
    }

    @Test
    @DisplayName("GET decodes each 'queries' parameter, commas included")
    void findLogs() throws Exception {
        List<Query> expected = List.of(
                Query.in("event", List.of("create", "update")),
                Query.limit(5));
        when(auditService.find(expected)).thenReturn(List.of(storedLog("a1")));

        mockMvc.perform(get(BASE_URL)
                        .param("queries",
                                "{\"method\":\"contains\",\"attribute\":\"event\",\"values\":[\"create\",\"update\"]}",
                                "{\"method\":\"limit\",\"values\":[5]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    @DisplayName("GET with an unknown query method answers 400 Invalid Query")
    void findLogs_unsupportedMethod() throws Exception {
        mockMvc.perform(get(BASE_URL).param("queries", "{\"method\":\"like\",\"attribute\":\"event\",\"values\":[\"x\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Invalid Query")))
                .andExpect(jsonPath("$.detail", is("Unsupported query method: like")));
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("GET /count with an unknown attribute answers 400 Invalid Query")
    void countLogs_unknownAttribute() throws Exception {
        when(auditService.count(List.of(Query.equal("password", "x"))))
                .thenThrow(new UnknownAttributeException("password"));

        mockMvc.perform(get(BASE_URL + "/count")
                        .param("queries", "{\"method\":\"equal\",\"attribute\":\"password\",\"values\":[\"x\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("Invalid attribute name: password")));
    }

    @Test
    @DisplayName("GET /users/{id} with events uses the user-and-events lookup and the paging parameters")
    void getUserLogs_withEvents() throws Exception {
        LogFilter filter = new LogFilter(Instant.parse("2024-01-01T00:00:00Z"), null, 10, 20, true);
        when(auditService.getLogsByUserAndEvents("u1", List.of("login", "logout"), filter))
                .thenReturn(List.of(storedLog("a1")));

        mockMvc.perform(get(BASE_URL + "/users/u1")
                        .param("events", "login", "logout")
                        .param("after", "2024-01-01T00:00:00Z")
                        .param("limit", "10")
                        .param("offset", "20")
                        .param("ascending", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].userId", is("u1")));
    }

    @Test
    @DisplayName("GET /users/{id}/count without events counts every log of the user")
    void countUserLogs() throws Exception {
        when(auditService.countLogsByUser("u1", LogFilter.defaults())).thenReturn(7L);

        mockMvc.perform(get(BASE_URL + "/users/u1/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(7)));
    }

    @Test
    @DisplayName("GET /resources defaults to 25 newest logs")
    void getResourceLogs_defaults() throws Exception {
        when(auditService.getLogsByResource("doc/1", LogFilter.defaults())).thenReturn(List.of());

        mockMvc.perform(get(BASE_URL + "/resources").param("resource", "doc/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        verify(auditService).getLogsByResource("doc/1", LogFilter.defaults());
    }

    @Test
    @DisplayName("GET /resources/count with events uses the resource-and-events count")
    void countResourceLogs_withEvents() throws Exception {
        when(auditService.countLogsByResourceAndEvents("doc/1", List.of("create"), LogFilter.defaults())).thenReturn(1L);

        mockMvc.perform(get(BASE_URL + "/resources/count").param("resource", "doc/1").param("events", "create"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(1)));
    }

    // --- cleanup ---

    @Test
    @DisplayName("DELETE accepts the cleanup with 202")
    void cleanup() throws Exception {
        Instant before = Instant.parse("2024-01-01T00:00:00Z");
        when(auditService.cleanup(before)).thenReturn(true);

        mockMvc.perform(delete(BASE_URL).param("before", "2024-01-01T00:00:00Z"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted", is(true)))
                .andExpect(jsonPath("$.before", is("2024-01-01T00:00:00Z")));
    }

    // --- backend errors ---

    @Test
    @DisplayName("Backend failures map to 502 and timeouts to 504")
    void backendErrors() throws Exception {
        when(auditService.getLogById("fail")).thenThrow(new TransportFailureException(500, "Code: 60. Table does not exist"));
        when(auditService.getLogById("slow")).thenThrow(
                new TransportTimeoutException("ClickHouse request timed out", new SocketTimeoutException("Read timed out")));
        when(auditService.getLogById("torn")).thenThrow(new TruncatedRowException(21, 3));

        mockMvc.perform(get(BASE_URL + "/fail"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.title", is("Storage Error")))
                .andExpect(jsonPath("$.backendStatus", is(500)));
        mockMvc.perform(get(BASE_URL + "/slow"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.title", is("Storage Timeout")));
        mockMvc.perform(get(BASE_URL + "/torn"))
                .andExpect(status().isBadGateway());
    }
}
