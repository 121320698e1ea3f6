package com.millennicare.identity.exception;

import com.millennicare.identity.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestCookieException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.io.IOException;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders every failure as {@code application/problem+json}. Domain failures arrive as
 * {@link ApiException}s thrown from {@code AuthResult.orElseThrow()}; the rest are framework
 * exceptions mapped to fixed, client-safe messages.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final int MAX_FIELD_ERRORS = 5;

    private final ErrorResponseWriter writer;

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        log.debug("{} {} -> {} {}", req.getMethod(), req.getRequestURI(), ex.getStatus().value(), ex.getMessage());
        String detail = ex.getMessage() == null || ex.getMessage().isBlank()
                ? "Request could not be processed."
                : ex.getMessage();
        writer.write(req, resp, ex.getStatus(), ex.getType(), ex.getTitle(), detail);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleInvalidBody(@NonNull HttpServletRequest req,
                                  @NonNull HttpServletResponse resp,
                                  @NonNull MethodArgumentNotValidException ex) throws IOException {
        validationProblem(req, resp, ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid")));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleInvalidParameter(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull ConstraintViolationException ex) throws IOException {
        validationProblem(req, resp, ex.getConstraintViolations().stream()
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage()));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingRequestCookieException.class,
            HttpMessageNotReadableException.class
    })
    public void handleUnreadableRequest(@NonNull HttpServletRequest req,
                                        @NonNull HttpServletResponse resp,
                                        @NonNull Exception ex) throws IOException {
        problem(req, resp, HttpStatus.BAD_REQUEST, "bad-request", "Bad Request",
                "Malformed or missing request parameters.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        problem(req, resp, HttpStatus.BAD_REQUEST, "type-mismatch", "Type Mismatch",
                "Parameter '" + ex.getName() + "' has invalid type.");
    }

    @ExceptionHandler(NoHandlerFoundException.class)
    public void handleNoHandler(@NonNull HttpServletRequest req,
                                @NonNull HttpServletResponse resp,
                                @NonNull NoHandlerFoundException ex) throws IOException {
        problem(req, resp, HttpStatus.NOT_FOUND, "not-found", "Not Found", "No handler for " + ex.getRequestURL());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        problem(req, resp, HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed", "Method Not Allowed",
                ex.getMethod() + " is not supported here.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        problem(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type", "Unsupported Media Type",
                "Send application/json.");
    }

    /** Unique-constraint races that escaped the services, e.g. a membership added twice. */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleConstraintRace(@NonNull HttpServletRequest req,
                                     @NonNull HttpServletResponse resp,
                                     @NonNull DataIntegrityViolationException ex) throws IOException {
        log.info("Constraint violation on {}: {}", req.getRequestURI(), ex.getMostSpecificCause().getMessage());
        problem(req, resp, HttpStatus.CONFLICT, "conflict", "Conflict",
                "The request conflicts with existing data.");
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public void handleRejected(@NonNull HttpServletRequest req,
                               @NonNull HttpServletResponse resp,
                               @NonNull RejectedExecutionException ex) throws IOException {
        log.warn("Executor rejected work: {}", ex.getMessage());
        problem(req, resp, HttpStatus.SERVICE_UNAVAILABLE, "service-unavailable", "Service Unavailable",
                "The service is busy. Try again shortly.");
    }

    @ExceptionHandler(Exception.class)
    public void handleUnexpected(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception on {} {}", req.getMethod(), req.getRequestURI(), ex);
        problem(req, resp, HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", "Internal Server Error",
                "An unexpected error occurred.");
    }

    private void validationProblem(HttpServletRequest req, HttpServletResponse resp,
                                   Stream<String> violations) throws IOException {
        String detail = violations.limit(MAX_FIELD_ERRORS).collect(Collectors.joining("; "));
        problem(req, resp, HttpStatus.UNPROCESSABLE_ENTITY, "validation-error", "Validation Error",
                detail.isBlank() ? "Request validation failed." : detail);
    }

    private void problem(HttpServletRequest req, HttpServletResponse resp, HttpStatus status,
                         String slug, String title, String detail) throws IOException {
        writer.write(req, resp, status, ApiException.PROBLEM_BASE + slug, title, detail);
    }
}
