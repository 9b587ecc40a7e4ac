package com.cardregistry.common;

import java.math.BigInteger;

/**
 * Range checks for unsigned 128-bit quantities (uses, levels, limits).
 */
public final class UInt128 {

    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private UInt128() {
    }

    public static boolean isValid(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX_VALUE) <= 0;
    }

    /**
     * @return the value itself when it lies in {@code [0, 2^128 - 1]}
     * @throws IllegalArgumentException when it is null or out of range
     */
    public static BigInteger require(BigInteger value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (!isValid(value)) {
            throw new IllegalArgumentException(
                String.format("%s must be an unsigned 128-bit value, got %s", name, value));
        }
        return value;
    }
}
