package com.cardregistry.common.exception;

/**
 * Thrown when a card does not exist, or when a holder scan finds no cards at all.
 */
public class CardNotFoundException extends CardRegistryException {

    private final Long cardId;
    private final String holderId;

    public CardNotFoundException(long cardId) {
        super("Card not found: " + cardId);
        this.cardId = cardId;
        this.holderId = null;
    }

    private CardNotFoundException(String message, String holderId) {
        super(message);
        this.cardId = null;
        this.holderId = holderId;
    }

    public static CardNotFoundException forHolder(String holderId) {
        return new CardNotFoundException("Holder owns no cards: " + holderId, holderId);
    }

    public static CardNotFoundException forHolderIndex(String holderId, long index) {
        return new CardNotFoundException(
            String.format("Holder %s has no card at index %d", holderId, index), holderId);
    }

    public Long getCardId() {
        return cardId;
    }

    public String getHolderId() {
        return holderId;
    }
}
