package com.florist.flowerservice.domain.flower;

/**
 * Display name of a flower: trimmed, non-blank, at most {@value #MAX_LENGTH} characters.
 *
 * @param value the normalized name
 */
public record FlowerName(String value) {

    public static final int MAX_LENGTH = 100;

    public FlowerName {
        if (value == null) {
            throw FlowerErrors.invalidName("name cannot be empty");
        }
        // trim() strips control characters that isBlank() does not treat as blank
        value = value.trim();
        if (value.isBlank()) {
            throw FlowerErrors.invalidName("name cannot be empty");
        }
        if (value.length() > MAX_LENGTH) {
            throw FlowerErrors.invalidName("name cannot exceed " + MAX_LENGTH + " characters");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
