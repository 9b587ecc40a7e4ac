package com.cardregistry.ledger;

/**
 * Ownership and enumeration substrate for cards.
 *
 * The ledger only knows who owns which card and who may act for the owner.
 * Use counters and levels live in {@code CardStateStore}; capability checks live in
 * the lifecycle layer.
 *
 * ENUMERATION CONTRACT:
 * A holder's cards are indexed {@code 0..balanceOf(holder)-1}. The order is stable
 * between ownership changes. A card arriving at a holder is appended at the end. A card
 * leaving a holder is replaced by the holder's last-indexed card (swap-and-pop), so
 * removal never shifts more than one index.
 */
public interface CardLedger {

    /**
     * Register a fresh card to a holder.
     *
     * @throws com.cardregistry.common.exception.RegistryHaltedException while halted
     * @throws com.cardregistry.common.exception.InvalidTransferException for a blank
     *         recipient or an identifier already in use
     */
    void mintOwnership(String to, long cardId);

    /**
     * Remove a card from its holder.
     *
     * @throws com.cardregistry.common.exception.RegistryHaltedException while halted
     * @throws com.cardregistry.common.exception.CardNotFoundException if the card is absent
     */
    void burnOwnership(long cardId);

    /**
     * Move a card between holders. Does not check who is asking; callers check
     * {@link #isApprovedOrOwner(String, long)} first.
     *
     * @throws com.cardregistry.common.exception.RegistryHaltedException while halted
     * @throws com.cardregistry.common.exception.InvalidTransferException if {@code from}
     *         is not the current owner or {@code to} is blank
     */
    void transferOwnership(String from, String to, long cardId);

    String ownerOf(long cardId);

    long balanceOf(String holderId);

    long cardOfOwnerByIndex(String holderId, long index);

    boolean exists(long cardId);

    boolean isApprovedOrOwner(String actorId, long cardId);

    long totalSupply();

    /**
     * Approve a single account to move or burn one card.
     * The actor must be the owner or an operator of the owner.
     */
    void approve(String actorId, String spenderId, long cardId);

    /**
     * @return the approved account for the card, or null
     */
    String getApproved(long cardId);

    void setApprovalForAll(String ownerId, String operatorId, boolean approved);

    boolean isApprovedForAll(String ownerId, String operatorId);
}
