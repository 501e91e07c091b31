package edu.nu.tasktracker.web;

import com.fasterxml.jackson.databind.JsonMappingException;
import edu.nu.tasktracker.dto.ErrorResponse;
import edu.nu.tasktracker.exception.ResourceNotFoundException;
import edu.nu.tasktracker.exception.UnauthenticatedException;
import edu.nu.tasktracker.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps exceptions to the shared {@link ErrorResponse} body.
 *
 * - 400 for validation problems, with per-field detail
 * - 401 for any authentication failure, never saying which check failed
 * - 404 for missing records and for records the caller may not access alike
 * - 500 for everything else; details are logged, not returned (outside dev)
 */
@ControllerAdvice
public class GlobalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    // In production, set spring.profiles.active=prod to minimize error exposure
    @Value("${spring.profiles.active:dev}")
    private String activeProfile;

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        log.warn("Resource not found: {} at {}", ex.getMessage(), request.getRequestURI());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), null, ex, request);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(
            UnauthenticatedException ex,
            HttpServletRequest request) {

        log.warn("Authentication failed: {} at {} from IP {}",
                ex.getMessage(),
                request.getRequestURI(),
                getClientIp(request));
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), null, ex, request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationException(
            AuthenticationException ex,
            HttpServletRequest request) {

        log.warn("Authentication failed: {} at {} from IP {}",
                ex.getMessage(),
                request.getRequestURI(),
                getClientIp(request));
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", "Authentication required", null, ex, request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            ValidationException ex,
            HttpServletRequest request) {

        log.debug("Validation error: {} at {}", ex.getMessage(), request.getRequestURI());
        Map<String, String> fields = ex.getField() != null
                ? Collections.singletonMap(ex.getField(), ex.getMessage())
                : null;
        return build(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), fields, ex, request);
    }

    /**
     * Bean Validation failures on request bodies (@NotBlank, @Email, @Size ...).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        String summary = String.join("; ", fields.values());

        log.debug("Validation failed: {} at {}", summary, request.getRequestURI());
        return build(HttpStatus.BAD_REQUEST, "Validation Error", "Invalid input: " + summary, fields, ex, request);
    }

    // query parameters that do not convert, e.g. completed=maybe or createdAfter=yesterday
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        String message = "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName();
        log.debug("{} at {}", message, request.getRequestURI());
        return build(HttpStatus.BAD_REQUEST, "Validation Error", message,
                Collections.singletonMap(ex.getName(), message), ex, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        log.debug("Unreadable request body at {}: {}", request.getRequestURI(), ex.getMessage());
        String field = offendingField(ex.getCause());
        if (field != null) {
            // well-formed JSON with a value that does not bind, e.g. role "superuser"
            String message = "Invalid value for " + field;
            return build(HttpStatus.BAD_REQUEST, "Validation Error", message,
                    Collections.singletonMap(field, message), ex, request);
        }
        return build(HttpStatus.BAD_REQUEST, "Validation Error", "Malformed request body", null, ex, request);
    }

    /**
     * Never expose SQL or schema details outside dev.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(
            DataAccessException ex,
            HttpServletRequest request) {

        log.error("Database error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        String message = isDevelopment()
                ? "Database error: " + ex.getMostSpecificCause().getMessage()
                : "An error occurred while processing your request";
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", message, null, ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unexpected error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        String message = isDevelopment()
                ? "Error: " + ex.getMessage()
                : "An unexpected error occurred. Please try again later.";
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", message, null, ex, request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                Map<String, String> fieldErrors, Exception ex,
                                                HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(request.getRequestURI())
                .fieldErrors(fieldErrors)
                .build();

        if (isDevelopment()) {
            body.setDebugMessage(ex.getMessage());
            body.setExceptionType(ex.getClass().getSimpleName());
        }
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Dotted path of the JSON property that failed to bind, or null for syntax errors.
     */
    private static String offendingField(Throwable cause) {
        if (!(cause instanceof JsonMappingException)) {
            return null;
        }
        List<JsonMappingException.Reference> path = ((JsonMappingException) cause).getPath();
        StringBuilder field = new StringBuilder();
        for (JsonMappingException.Reference ref : path) {
            if (ref.getFieldName() != null) {
                if (field.length() > 0) {
                    field.append('.');
                }
                field.append(ref.getFieldName());
            }
        }
        return field.length() > 0 ? field.toString() : null;
    }

    private boolean isDevelopment() {
        return "dev".equalsIgnoreCase(activeProfile) || "development".equalsIgnoreCase(activeProfile);
    }

    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
