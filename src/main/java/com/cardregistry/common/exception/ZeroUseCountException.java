package com.cardregistry.common.exception;

/**
 * Thrown when a use is requested with a count of zero.
 */
public class ZeroUseCountException extends CardRegistryException {

    public ZeroUseCountException() {
        super("Use count must be greater than zero");
    }
}
