package com.logsink.intake.rest;

import com.logsink.core.channel.ChannelPublishException;
import com.logsink.core.ingest.RecordValidationException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.OffsetDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * ProblemDetail responses for {@link IngestController}. Validation problems name the offending
 * field; channel problems tell the caller the whole request may be retried.
 */
@RestControllerAdvice(assignableTypes = IngestController.class)
public class IntakeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(IntakeExceptionHandler.class);

    private final Clock clock;

    public IntakeExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(RecordValidationException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRecord(RecordValidationException ex, HttpServletRequest request) {
        log.warn("Ingest request validation failed: {} (path={})", ex.getMessage(), request.getRequestURI());

        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Invalid log record", request);
        problem.setProperty("code", errorCodeFor(ex));
        if (ex.getField() != null) {
            problem.setProperty("field", ex.getField());
        }
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ChannelPublishException.class)
    public ResponseEntity<ProblemDetail> handleChannelFailure(ChannelPublishException ex, HttpServletRequest request) {
        log.error("Failed to enqueue log record (path={})", request.getRequestURI(), ex);

        ProblemDetail problem = problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to enqueue log record; the request may be retried",
                "Delivery channel unavailable",
                request);
        problem.setProperty("code", "ingest.channel-unavailable");
        return ResponseEntity.internalServerError().body(problem);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleStatus(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatusCode status = ex.getStatusCode();
        String detail = ex.getReason() != null ? ex.getReason() : "Request could not be processed";
        log.warn("Ingest request rejected with {}: {} (path={})", status.value(), detail, request.getRequestURI());

        ProblemDetail problem = problem(status, detail, "Rejected ingest request", request);
        problem.setProperty(
                "code",
                status.value() == HttpStatus.UNSUPPORTED_MEDIA_TYPE.value()
                        ? "ingest.unsupported-media-type"
                        : "ingest.invalid-request");
        return ResponseEntity.status(status).body(problem);
    }

    private ProblemDetail problem(HttpStatusCode status, String detail, String title, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("timestamp", OffsetDateTime.now(clock));
        problem.setProperty("path", request.getRequestURI());
        return problem;
    }

    private static String errorCodeFor(RecordValidationException ex) {
        return switch (ex.getKind()) {
            case INVALID_BODY -> "ingest.invalid-request";
            case REQUIRED_FIELD_MISSING -> "ingest.required-field-missing";
            case INVALID_FIELD -> "ingest.invalid-field";
            case TEXT_TOO_LONG -> "ingest.text-too-long";
        };
    }
}
