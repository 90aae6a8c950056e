package com.florist.flowerservice.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/** Body of {@code PUT /api/flowers/{id}}. Null fields are left unchanged. */
public record UpdateFlowerRequest(
        @Schema(example = "Red Rose") @Size(max = 100) String name,
        @Schema(example = "red") @Size(max = 50) String color,
        String description,
        @Schema(example = "30000.0") @PositiveOrZero Double price,
        @Schema(example = "150") @PositiveOrZero Integer stock) {}
