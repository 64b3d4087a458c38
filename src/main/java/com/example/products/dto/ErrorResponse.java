package com.example.products.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

@Schema(description = "Error body returned by the products endpoints for invalid input, missing products and server errors")
public record ErrorResponse(
    int status,
    String error,
    String message,
    String path,
    String timestamp,
    List<FieldError> fieldErrors
) {

    public record FieldError(String field, String message) {}

    public static ErrorResponse of(HttpStatusCode status, String message, String path) {
        return of(status, message, path, List.of());
    }

    public static ErrorResponse of(HttpStatusCode status, String message, String path, List<FieldError> fieldErrors) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String reason = resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value());
        return new ErrorResponse(status.value(), reason, message, path, Instant.now().toString(), fieldErrors);
    }
}
