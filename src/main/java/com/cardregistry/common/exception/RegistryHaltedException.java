package com.cardregistry.common.exception;

/**
 * Thrown when an ownership change is attempted while the registry is in maintenance mode.
 */
public class RegistryHaltedException extends CardRegistryException {

    public RegistryHaltedException(String operation) {
        super("Registry is halted, cannot perform operation: " + operation);
    }
}
