package com.cardregistry.common.exception;

/**
 * Base exception for all card registry exceptions.
 */
public class CardRegistryException extends RuntimeException {

    public CardRegistryException(String message) {
        super(message);
    }

    public CardRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
