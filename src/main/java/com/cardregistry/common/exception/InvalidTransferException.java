package com.cardregistry.common.exception;

/**
 * Thrown when an ownership primitive is misused: wrong source holder, empty recipient,
 * duplicate mint or self-approval.
 */
public class InvalidTransferException extends CardRegistryException {

    public InvalidTransferException(String message) {
        super(message);
    }
}
