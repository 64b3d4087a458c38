package com.example.products.dto;

import com.example.products.model.Product;
import com.example.products.validation.FiniteNumber;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Body of create and update requests. The constraints here are what the
 * request validation enforces and what the OpenAPI document publishes.
 */
@Schema(description = "Product payload for create and update")
public record ProductRequest(
    @Schema(description = "Product name", example = "Chair", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "name is required")
    String name,

    @Schema(description = "Unit price", example = "49.99", minimum = "0", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotNull(message = "price is required")
    @PositiveOrZero(message = "price must not be negative")
    @FiniteNumber(message = "price must be a finite number")
    Double price,

    @Schema(description = "Product color", example = "red")
    String color,

    @Schema(description = "Units in stock", example = "10", minimum = "0", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotNull(message = "stock is required")
    @PositiveOrZero(message = "stock must not be negative")
    Integer stock
) {

    public Product toEntity() {
        return new Product(name, price, color, stock);
    }

    public void applyTo(Product product) {
        product.setName(name);
        product.setPrice(price);
        product.setColor(color);
        product.setStock(stock);
    }
}
