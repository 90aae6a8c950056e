package com.florist.flowerservice.infrastructure.web;

import com.florist.flowerservice.domain.shared.BadRequestException;
import com.florist.flowerservice.domain.shared.NotFoundException;
import com.florist.flowerservice.domain.shared.ValidationException;
import com.florist.flowerservice.infrastructure.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} bodies.
 *
 * <p>Besides the standard fields every body carries {@code success: false}, the client-facing
 * {@code error} message, a {@code timestamp} and the request's {@code correlation_id}. These
 * extension members are map keys, which the Jackson naming strategy does not rename:
 *
 * <pre>
 * {
 *   "type": "https://florist.example.com/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "Flower not found with id: 550e8400-e29b-41d4-a716-446655440099",
 *   "success": false,
 *   "error": "Flower not found with id: 550e8400-e29b-41d4-a716-446655440099",
 *   "timestamp": "2024-12-11T10:30:00Z",
 *   "correlation_id": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://florist.example.com/errors/";

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ProblemDetail handleDomainValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", ex.getMessage());
    }

    @ExceptionHandler({BadRequestException.class, IllegalArgumentException.class})
    public ProblemDetail handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String detail = "Invalid value for '" + ex.getName() + "': " + ex.getValue();
        log.warn("Bad request: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request body");
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleDataAccess(DataAccessException ex) {
        log.error("Database error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                INTERNAL_ERROR_MESSAGE);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        // Spring MVC's own exceptions (unknown route, wrong method, ...) carry their status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
            HttpStatus resolved = HttpStatus.resolve(status.value());
            String title = resolved != null ? resolved.getReasonPhrase() : "Error";
            String detail = errorResponse.getBody().getDetail();
            return problem(status, title, "request", detail != null ? detail : title);
        }
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                INTERNAL_ERROR_MESSAGE);
    }

    private ProblemDetail problem(HttpStatusCode status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("success", false);
        problem.setProperty("error", detail);
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlation_id", ctx.correlationId()));
        return problem;
    }
}
