package com.florist.flowerservice.domain.shared;

/**
 * Base type for every error raised by the domain and application layers.
 *
 * <p>The message is client-facing: {@code GlobalExceptionHandler} copies it into the {@code error}
 * field of the response body.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
