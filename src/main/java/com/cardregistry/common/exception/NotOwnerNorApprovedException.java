package com.cardregistry.common.exception;

/**
 * Thrown when an actor that neither owns a card nor is approved for it tries to move or burn it.
 */
public class NotOwnerNorApprovedException extends CardRegistryException {

    private final String actorId;
    private final long cardId;

    public NotOwnerNorApprovedException(String actorId, long cardId) {
        super(String.format("Caller %s is not owner nor approved for card %d", actorId, cardId));
        this.actorId = actorId;
        this.cardId = cardId;
    }

    public String getActorId() {
        return actorId;
    }

    public long getCardId() {
        return cardId;
    }
}
