package com.cardregistry.common.exception;

/**
 * Thrown when parallel batch inputs are empty or differ in length.
 */
public class WrongInputParamsException extends CardRegistryException {

    public WrongInputParamsException(int leftSize, int rightSize) {
        super(String.format("Batch inputs must be non-empty and of equal length, got %d and %d",
            leftSize, rightSize));
    }
}
