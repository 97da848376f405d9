package dev.aparikh.emailtriage.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Body of every non-2xx API response. {@code code} is one of the constants below and is what
 * callers should branch on; {@code message} is for humans.
 */
@Schema(description = "Error response")
public record ErrorResponse(
        @Schema(description = "Human-readable description", example = "Email not found: 18c2f0a9")
        String message,

        @Schema(description = "Machine-readable error code", example = "NOT_FOUND",
                allowableValues = {ErrorResponse.VALIDATION_ERROR, ErrorResponse.INVALID_ARGUMENT,
                        ErrorResponse.NOT_FOUND, ErrorResponse.SEARCH_FAILED, ErrorResponse.INTERNAL_ERROR})
        String code,

        @Schema(description = "When the error was produced", example = "2025-01-01T10:00:00Z")
        Instant timestamp
) {
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String SEARCH_FAILED = "SEARCH_FAILED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static ErrorResponse of(String message, String code) {
        return new ErrorResponse(message, code, Instant.now());
    }
}
