package com.scriptorium.documentservice.infrastructure.web;

import com.scriptorium.templateregistry.TemplateNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://scriptorium.dev/errors/template-not-found",
 *   "title": "Template Not Found",
 *   "status": 404,
 *   "detail": "Template 'lease' not found",
 *   "templateName": "lease",
 *   "timestamp": "2026-10-17T10:30:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TemplateNotFoundException.class)
    public ProblemDetail handleTemplateNotFound(TemplateNotFoundException ex) {
        log.debug("Template lookup miss: {}", ex.templateName());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Template Not Found");
        problem.setType(URI.create("https://scriptorium.dev/errors/template-not-found"));
        problem.setProperty("templateName", ex.templateName());
        addTimestamp(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create("https://scriptorium.dev/errors/bad-request"));
        addTimestamp(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://scriptorium.dev/errors/internal"));
        addTimestamp(problem);
        return problem;
    }

    private void addTimestamp(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
    }
}
