package com.florist.flowerservice.application.dto;

import com.florist.flowerservice.domain.flower.Flower;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;

/** JSON view of a {@link Flower}. */
@Schema(name = "Flower")
public record FlowerResponse(
        @Schema(example = "550e8400-e29b-41d4-a716-446655440001") UUID id,
        @Schema(example = "Rose") String name,
        @Schema(example = "red") String color,
        @Schema(example = "A beautiful red rose", nullable = true) String description,
        @Schema(example = "25000.0") double price,
        @Schema(example = "100") int stock,
        Instant createdAt,
        Instant updatedAt) {

    public static FlowerResponse from(Flower flower) {
        return new FlowerResponse(
                flower.id(),
                flower.name(),
                flower.color(),
                flower.description(),
                flower.price(),
                flower.stock(),
                flower.createdAt(),
                flower.updatedAt());
    }
}
