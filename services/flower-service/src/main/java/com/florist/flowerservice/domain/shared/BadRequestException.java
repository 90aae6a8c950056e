package com.florist.flowerservice.domain.shared;

/** The request itself is malformed, independent of any entity rule. Mapped to HTTP 400. */
public class BadRequestException extends DomainException {

    public BadRequestException(String message) {
        super(message);
    }
}
