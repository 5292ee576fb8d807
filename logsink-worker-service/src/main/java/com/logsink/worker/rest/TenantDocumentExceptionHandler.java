package com.logsink.worker.rest;

import com.logsink.core.store.TenantStoreException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.OffsetDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RequiredArgsConstructor
@RestControllerAdvice(assignableTypes = TenantDocumentController.class)
public class TenantDocumentExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleInvalidPath(IllegalArgumentException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), "Invalid document path", request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleStatus(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return build(status, ex.getReason(), status.getReasonPhrase(), request);
    }

    @ExceptionHandler(TenantStoreException.class)
    public ResponseEntity<ProblemDetail> handleStoreFailure(TenantStoreException ex, HttpServletRequest request) {
        log.error("Document read failed (path={})", request.getRequestURI(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Document store unavailable", "Store failure", request);
    }

    private ResponseEntity<ProblemDetail> build(
            HttpStatus status, String detail, String title, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("timestamp", OffsetDateTime.now(clock));
        problem.setProperty("path", request.getRequestURI());
        return ResponseEntity.status(status).body(problem);
    }
}
