package tech.yump.audit.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.audit.adapter.CorruptRowException;
import tech.yump.audit.adapter.InvalidConfigurationException;
import tech.yump.audit.adapter.InvalidLogDataException;
import tech.yump.audit.adapter.MissingRequiredAttributeException;
import tech.yump.audit.adapter.TransportFailureException;
import tech.yump.audit.adapter.TransportTimeoutException;
import tech.yump.audit.adapter.TruncatedRowException;
import tech.yump.audit.adapter.UnknownAttributeException;
import tech.yump.audit.adapter.UnsupportedMethodException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    // --- Specific Handlers ---

    @ExceptionHandler({UnknownAttributeException.class, UnsupportedMethodException.class})
    public ResponseEntity<ProblemDetail> handleInvalidQuery(RuntimeException ex, HttpServletRequest request) {
        return badRequest("Invalid Query", ex, request);
    }

    @ExceptionHandler(MissingRequiredAttributeException.class)
    public ResponseEntity<ProblemDetail> handleMissingAttribute(MissingRequiredAttributeException ex, HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = badRequest("Missing Required Attribute", ex, request);
        response.getBody().setProperty("attribute", ex.getAttribute());
        return response;
    }

    @ExceptionHandler({InvalidConfigurationException.class, InvalidLogDataException.class, IllegalArgumentException.class})
    public ResponseEntity<ProblemDetail> handleIllegalArgument(RuntimeException ex, HttpServletRequest request) {
        return badRequest("Bad Request", ex, request);
    }

    @ExceptionHandler(TransportTimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(TransportTimeoutException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.GATEWAY_TIMEOUT;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "The audit storage backend did not respond in time.");
        problemDetail.setTitle("Storage Timeout");
        log.warn("Storage timeout: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(TransportFailureException.class)
    public ResponseEntity<ProblemDetail> handleTransportFailure(TransportFailureException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_GATEWAY;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "The audit storage backend rejected the request.");
        problemDetail.setTitle("Storage Error");
        if (ex.getStatusCode() > 0) {
            problemDetail.setProperty("backendStatus", ex.getStatusCode());
        }
        log.error("Storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler({CorruptRowException.class, TruncatedRowException.class})
    public ResponseEntity<ProblemDetail> handleUndecodableResult(RuntimeException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_GATEWAY;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "The audit storage backend returned an unreadable result.");
        problemDetail.setTitle("Storage Error");
        log.error("Undecodable storage result: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        // underlying cause is logged, not exposed
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}",
                request.getDescription(false),
                ex.getMessage());
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }

    private ResponseEntity<ProblemDetail> badRequest(String title, RuntimeException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(title);
        log.warn("{}: {}. Request: {} {}", title, ex.getMessage(), request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(status).body(problemDetail);
    }
}
