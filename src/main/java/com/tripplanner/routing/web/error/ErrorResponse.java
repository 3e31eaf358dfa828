package com.tripplanner.routing.web.error;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "ErrorResponse", description = "API error envelope")
public class ErrorResponse {
    @Schema(description = "When the error occurred", example = "2025-12-02T12:00:00Z")
    private OffsetDateTime timestamp;
    @Schema(description = "HTTP status", example = "400")
    private int status;
    @Schema(description = "Status reason", example = "Bad Request")
    private String error;
    @Schema(description = "Error message", example = "Validation failed")
    private String message;
    @Schema(description = "Request path", example = "uri=/api/routes")
    private String path;
    @Schema(description = "Whether the same request may succeed later", example = "false")
    private boolean retryable;
    @Schema(description = "Validation violations")
    private List<Violation> violations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "Violation", description = "Error for one field")
    public static class Violation {
        @Schema(description = "Field", example = "coordinates")
        private String field;
        @Schema(description = "Message", example = "size must be between 2 and 2147483647")
        private String message;
    }
}

