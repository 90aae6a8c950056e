package com.florist.flowerservice.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/flowers}. {@code price} and {@code stock} default to 0 when omitted.
 *
 * <p>The constraints here give early 400s with field names; {@code Flower.create} enforces the
 * same rules again.
 */
public record CreateFlowerRequest(
        @Schema(example = "Rose", maxLength = 100) @NotBlank @Size(max = 100) String name,
        @Schema(example = "red", maxLength = 50) @NotBlank @Size(max = 50) String color,
        @Schema(example = "A beautiful red rose") String description,
        @Schema(example = "25000.0", defaultValue = "0") @PositiveOrZero Double price,
        @Schema(example = "100", defaultValue = "0") @PositiveOrZero Integer stock) {

    public double priceOrDefault() {
        return price != null ? price : 0.0;
    }

    public int stockOrDefault() {
        return stock != null ? stock : 0;
    }
}
