package com.florist.flowerservice.domain.flower;

import java.util.Locale;

/**
 * Color of a flower, stored lower-cased so that filtering by color is an exact match.
 *
 * @param value trimmed, lower-cased color, at most {@value #MAX_LENGTH} characters
 */
public record FlowerColor(String value) {

    public static final int MAX_LENGTH = 50;

    public FlowerColor {
        if (value == null) {
            throw FlowerErrors.invalidColor("color cannot be empty");
        }
        // trim() strips control characters that isBlank() does not treat as blank
        value = value.trim().toLowerCase(Locale.ROOT);
        if (value.isBlank()) {
            throw FlowerErrors.invalidColor("color cannot be empty");
        }
        if (value.length() > MAX_LENGTH) {
            throw FlowerErrors.invalidColor("color cannot exceed " + MAX_LENGTH + " characters");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
