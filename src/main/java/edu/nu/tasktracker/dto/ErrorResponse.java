package edu.nu.tasktracker.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Single error body used by every failing endpoint.
 * Stack traces and exception class names only appear under the dev profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private LocalDateTime timestamp;

    // HTTP status code (400, 401, 404, 429, 500)
    private int status;

    // Short error type, e.g. "Validation Error", "Not Found"
    private String error;

    private String message;

    private String path;

    // field name -> problem, only for validation errors
    private Map<String, String> fieldErrors;

    // dev profile only
    private String debugMessage;
    private String exceptionType;
}
