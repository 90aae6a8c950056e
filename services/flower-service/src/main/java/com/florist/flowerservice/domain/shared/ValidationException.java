package com.florist.flowerservice.domain.shared;

/** A value violates a domain rule (blank name, negative price, ...). Mapped to HTTP 400. */
public class ValidationException extends DomainException {

    public ValidationException(String message) {
        super(message);
    }
}
