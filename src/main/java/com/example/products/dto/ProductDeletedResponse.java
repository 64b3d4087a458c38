package com.example.products.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Confirmation of a deleted product")
public record ProductDeletedResponse(
    @Schema(description = "Identifier of the removed product", example = "1")
    Long id,

    @Schema(example = "Product deleted")
    String message
) {

    public static ProductDeletedResponse of(Long id) {
        return new ProductDeletedResponse(id, "Product deleted");
    }
}
