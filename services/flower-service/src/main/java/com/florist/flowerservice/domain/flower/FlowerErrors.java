package com.florist.flowerservice.domain.flower;

import com.florist.flowerservice.domain.shared.NotFoundException;
import com.florist.flowerservice.domain.shared.ValidationException;
import java.util.UUID;

/** Factory for flower-specific domain errors. */
public final class FlowerErrors {

    private FlowerErrors() {}

    public static NotFoundException notFound(UUID id) {
        return new NotFoundException("Flower not found with id: " + id);
    }

    public static ValidationException invalidName(String reason) {
        return new ValidationException("Invalid flower name: " + reason);
    }

    public static ValidationException invalidColor(String reason) {
        return new ValidationException("Invalid flower color: " + reason);
    }

    public static ValidationException invalidPrice(String reason) {
        return new ValidationException("Invalid flower price: " + reason);
    }

    public static ValidationException invalidStock(String reason) {
        return new ValidationException("Invalid flower stock: " + reason);
    }

    public static ValidationException insufficientStock() {
        return new ValidationException("Insufficient stock");
    }
}
