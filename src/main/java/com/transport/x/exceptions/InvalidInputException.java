package com.transport.x.exceptions;

/**
 * Thrown when a transportation instance or generator request is malformed.
 * <p>
 * Raised before any residual graph is built, so no {@code Edge} of the rejected instance
 * has been touched when a caller sees it. An instance whose supply simply cannot be routed is
 * not malformed and never raises this exception.
 * </p>
 */
public class InvalidInputException extends RuntimeException {

    /**
     * Constructs a new InvalidInputException with the specified detail message.
     *
     * @param message the detail message which explains what is wrong with the input.
     */
    public InvalidInputException(String message) {
        super(message);
    }
}
