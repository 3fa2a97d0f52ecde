package tech.yump.audit.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.audit.adapter.LogFilter;
import tech.yump.audit.api.ApiError;
import tech.yump.audit.api.dto.CleanupResponse;
import tech.yump.audit.api.dto.CountResponse;
import tech.yump.audit.log.Log;
import tech.yump.audit.query.Query;
import tech.yump.audit.query.QueryCodec;
import tech.yump.audit.service.AuditService;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/v1/audit/logs")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Audit Logs", description = "Recording, querying and retention of audit logs")
public class AuditLogController {

    private static final String QUERIES_PARAM = "queries";

    private final AuditService auditService;
    private final QueryCodec queryCodec;

    @PostMapping
    @Operation(summary = "Record audit log", description = "Stores one audit log. The id and, when omitted, the time are assigned by the server.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Log stored."),
            @ApiResponse(responseCode = "400", description = "A required attribute is missing or the body is malformed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "The storage backend rejected the request.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "504", description = "The storage backend timed out.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Log> createLog(@RequestBody Log request) {
        log.info("Received request to record '{}' audit log", request.event());
        Log stored = auditService.log(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(stored);
    }

    @PostMapping("/batch")
    @Operation(summary = "Record audit logs in batch", description = "Stores all logs in one statement. Nothing is stored when any log is invalid.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "All logs stored."),
            @ApiResponse(responseCode = "400", description = "A log is missing a required attribute.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "The storage backend rejected the request.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<List<Log>> createLogs(@RequestBody List<Log> request) {
        log.info("Received request to record batch of {} audit logs", request.size());
        return ResponseEntity.status(HttpStatus.CREATED).body(auditService.logBatch(request));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Read audit log", description = "Retrieves a single audit log by id.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Log found."),
            @ApiResponse(responseCode = "404", description = "No log with this id.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<?> getLog(@Parameter(description = "Log id.", required = true) @PathVariable String id) {
        return auditService.getLogById(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.info("Audit log {} not found", id);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("Audit log not found: " + id));
                });
    }

    @GetMapping
    @Operation(summary = "Find audit logs", description = "Returns the logs matching every JSON-encoded query passed in a 'queries' parameter, e.g. {\"method\":\"equal\",\"attribute\":\"userId\",\"values\":[\"u1\"]}.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Matching logs."),
            @ApiResponse(responseCode = "400", description = "A query is malformed or names an unknown attribute.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public List<Log> findLogs(@Parameter(hidden = true) @RequestParam MultiValueMap<String, String> parameters) {
        return auditService.find(queries(parameters));
    }

    @GetMapping("/count")
    @Operation(summary = "Count audit logs", description = "Counts the logs matching the JSON-encoded 'queries' parameters. Ordering and paging queries are ignored.")
    public CountResponse countLogs(@Parameter(hidden = true) @RequestParam MultiValueMap<String, String> parameters) {
        return new CountResponse(auditService.count(queries(parameters)));
    }

    @GetMapping("/users/{userId}")
    @Operation(summary = "Logs of a user", description = "Newest first unless 'ascending' is set, optionally restricted to the given events and time range.")
    public List<Log> getUserLogs(
            @PathVariable String userId,
            @RequestParam(required = false) List<String> events,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant after,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before,
            @RequestParam(defaultValue = "25") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "false") boolean ascending) {
        LogFilter filter = new LogFilter(after, before, limit, offset, ascending);
        return hasEvents(events)
                ? auditService.getLogsByUserAndEvents(userId, events, filter)
                : auditService.getLogsByUser(userId, filter);
    }

    @GetMapping("/users/{userId}/count")
    @Operation(summary = "Count logs of a user")
    public CountResponse countUserLogs(
            @PathVariable String userId,
            @RequestParam(required = false) List<String> events,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant after,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before) {
        LogFilter filter = LogFilter.defaults().between(after, before);
        long count = hasEvents(events)
                ? auditService.countLogsByUserAndEvents(userId, events, filter)
                : auditService.countLogsByUser(userId, filter);
        return new CountResponse(count);
    }

    @GetMapping("/resources")
    @Operation(summary = "Logs of a resource", description = "Newest first unless 'ascending' is set, optionally restricted to the given events and time range.")
    public List<Log> getResourceLogs(
            @Parameter(description = "Resource path.", example = "database/db1/collection/col1") @RequestParam String resource,
            @RequestParam(required = false) List<String> events,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant after,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before,
            @RequestParam(defaultValue = "25") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "false") boolean ascending) {
        LogFilter filter = new LogFilter(after, before, limit, offset, ascending);
        return hasEvents(events)
                ? auditService.getLogsByResourceAndEvents(resource, events, filter)
                : auditService.getLogsByResource(resource, filter);
    }

    @GetMapping("/resources/count")
    @Operation(summary = "Count logs of a resource")
    public CountResponse countResourceLogs(
            @RequestParam String resource,
            @RequestParam(required = false) List<String> events,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant after,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before) {
        LogFilter filter = LogFilter.defaults().between(after, before);
        long count = hasEvents(events)
                ? auditService.countLogsByResourceAndEvents(resource, events, filter)
                : auditService.countLogsByResource(resource, filter);
        return new CountResponse(count);
    }

    @DeleteMapping
    @Operation(summary = "Delete old audit logs", description = "Deletes every log strictly older than 'before'. Deletion completes asynchronously.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Deletion accepted."),
            @ApiResponse(responseCode = "502", description = "The storage backend rejected the request.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<CleanupResponse> cleanup(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before) {
        log.info("Received request to delete audit logs older than {}", before);
        boolean accepted = auditService.cleanup(before);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new CleanupResponse(accepted, before));
    }

    // JSON queries contain commas, so they are read raw instead of bound to a List
    private List<Query> queries(MultiValueMap<String, String> parameters) {
        return queryCodec.parseAll(parameters.getOrDefault(QUERIES_PARAM, List.of()));
    }

    private boolean hasEvents(List<String> events) {
        return events != null && !events.isEmpty();
    }
}
