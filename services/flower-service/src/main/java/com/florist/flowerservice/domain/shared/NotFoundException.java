package com.florist.flowerservice.domain.shared;

/** The requested entity does not exist. Mapped to HTTP 404. */
public class NotFoundException extends DomainException {

    public NotFoundException(String message) {
        super(message);
    }
}
