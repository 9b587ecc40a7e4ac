package com.cardregistry.common.exception;

import java.math.BigInteger;

/**
 * Thrown when applying a use would push a card past the configured maximum.
 */
public class MaxUsesReachedException extends CardRegistryException {

    private final Long cardId;
    private final BigInteger requested;
    private final BigInteger maxUses;

    public MaxUsesReachedException(long cardId, BigInteger currentUses, BigInteger requested,
                                   BigInteger maxUses) {
        super(String.format("Card %d cannot take %s more uses: %s of %s already used",
            cardId, requested, currentUses, maxUses));
        this.cardId = cardId;
        this.requested = requested;
        this.maxUses = maxUses;
    }

    private MaxUsesReachedException(String message, BigInteger requested, BigInteger maxUses) {
        super(message);
        this.cardId = null;
        this.requested = requested;
        this.maxUses = maxUses;
    }

    /**
     * No card of the holder can absorb the requested count.
     */
    public static MaxUsesReachedException forHolder(String holderId, BigInteger requested,
                                                    BigInteger maxUses) {
        return new MaxUsesReachedException(
            String.format("No card of holder %s can take %s more uses (max: %s)",
                holderId, requested, maxUses),
            requested, maxUses);
    }

    public Long getCardId() {
        return cardId;
    }

    public BigInteger getRequested() {
        return requested;
    }

    public BigInteger getMaxUses() {
        return maxUses;
    }
}
