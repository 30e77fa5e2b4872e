package com.vnaddress.processing;

/**
 * Thrown when the caller passes something that is not address text.
 */
public class InvalidAddressInputException extends IllegalArgumentException {

    public InvalidAddressInputException(String message) {
        super(message);
    }
}
