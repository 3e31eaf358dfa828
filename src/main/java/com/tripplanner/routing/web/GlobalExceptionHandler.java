package com.tripplanner.routing.web;

import com.tripplanner.routing.error.InvalidRouteRequestException;
import com.tripplanner.routing.error.RoutingUnavailableException;
import com.tripplanner.routing.web.error.ErrorResponse;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ApiResponses({
            @ApiResponse(responseCode = "400", description = "Request validation failed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          WebRequest request) {
        // validation errors are the caller's problem, no stack trace
        log.warn("Validation failed at {}: {}", request.getDescription(false), ex.getMessage());

        List<ErrorResponse.Violation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toViolation)
                .collect(Collectors.toList());

        ErrorResponse body = base(HttpStatus.BAD_REQUEST, "Validation failed", request)
                .violations(violations)
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({InvalidRouteRequestException.class, HttpMessageNotReadableException.class})
    @ApiResponses({
            @ApiResponse(responseCode = "400", description = "Malformed route request",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, WebRequest request) {
        log.warn("Rejected request at {}: {}", request.getDescription(false), ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(base(HttpStatus.BAD_REQUEST, message, request).build());
    }

    @ExceptionHandler(RoutingUnavailableException.class)
    @ApiResponses({
            @ApiResponse(responseCode = "503", description = "No routing provider available",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleUnavailable(RoutingUnavailableException ex,
                                                           WebRequest request) {
        log.error("Routing unavailable at {}: {}", request.getDescription(false), ex.getFailures());
        ErrorResponse body = base(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request)
                .retryable(ex.isRetryable())
                .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(Exception.class)
    @ApiResponses({
            @ApiResponse(responseCode = "500", description = "Internal server error",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex,
                                                       WebRequest request) {
        log.error("Unhandled exception occurred at path: {}", request.getDescription(false), ex);

        ErrorResponse body = base(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request).build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse.ErrorResponseBuilder base(HttpStatus status, String message, WebRequest request) {
        return ErrorResponse.builder()
                .timestamp(OffsetDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getDescription(false));
    }

    private ErrorResponse.Violation toViolation(FieldError e) {
        return new ErrorResponse.Violation(e.getField(), e.getDefaultMessage());
    }
}
