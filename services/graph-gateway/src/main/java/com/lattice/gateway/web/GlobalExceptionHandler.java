package com.lattice.gateway.web;

import com.lattice.common.ErrorKind;
import com.lattice.common.LatticeError;
import com.lattice.common.LatticeException;
import com.lattice.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <p>A {@link LatticeException} becomes:
 *
 * <pre>
 * {
 *   "type": "https://lattice.dev/errors/namespace-not-supported",
 *   "title": "Namespace Not Supported",
 *   "status": 400,
 *   "detail": "Namespace operation not supported: createTenant (namespace: acme)",
 *   "kind": "NAMESPACE_NOT_SUPPORTED",
 *   "operation": "createTenant",
 *   "suggestion": "Upgrade to an enterprise graph backend ...",
 *   "currentMode": "oss-single-tenant",
 *   "timestamp": "2026-01-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://lattice.dev/errors/";

    @ExceptionHandler(LatticeException.class)
    public ProblemDetail handleLattice(LatticeException ex) {
        LatticeError error = ex.error();
        HttpStatus status = statusOf(error.kind());
        if (status.is5xxServerError()) {
            log.error("{}", error.message(), ex);
        } else {
            log.warn("{}", error.message());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, error.details());
        problem.setTitle(titleOf(error.kind()));
        problem.setType(URI.create(ERROR_TYPE_BASE + error.kind().name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("kind", error.kind().name());
        problem.setProperty("operation", error.operation());
        if (!error.suggestion().isEmpty()) {
            problem.setProperty("suggestion", error.suggestion());
        }
        error.attributes().forEach(problem::setProperty);
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case ENTERPRISE_FEATURE_NOT_AVAILABLE, NAMESPACE_NOT_SUPPORTED, INVALID_NODE_INPUT, PROTECTED_TENANT ->
                    HttpStatus.BAD_REQUEST;
            case INVALID_LEVEL, NODE_TYPE_NOT_ALLOWED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case HIERARCHY_NOT_FOUND, TENANT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CAPABILITY_DETECTION_FAILED, BACKEND_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static String titleOf(ErrorKind kind) {
        StringBuilder title = new StringBuilder();
        for (String word : kind.name().split("_")) {
            if (!title.isEmpty()) {
                title.append(' ');
            }
            title.append(word.charAt(0)).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return title.toString();
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
