package com.cardregistry.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ownership record of a single card.
 *
 * The row exists exactly as long as the card exists; burning deletes it.
 */
@Entity
@Table(name = "card_ownerships", indexes = {
    @Index(name = "idx_ownership_owner_index", columnList = "owner_id, owner_index")
})
@Data
@NoArgsConstructor
public class CardOwnership {

    @Id
    private Long cardId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    /**
     * Position of this card in its owner's enumeration.
     */
    @Column(name = "owner_index", nullable = false)
    private long ownerIndex;

    /**
     * Single account approved to move this card. Cleared on every transfer.
     */
    private String approvedId;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public CardOwnership(long cardId, String ownerId, long ownerIndex) {
        this.cardId = cardId;
        this.ownerId = ownerId;
        this.ownerIndex = ownerIndex;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public void moveTo(String newOwnerId, long newIndex) {
        this.ownerId = newOwnerId;
        this.ownerIndex = newIndex;
        this.approvedId = null;
        this.updatedAt = Instant.now();
    }

    public void reindex(long newIndex) {
        this.ownerIndex = newIndex;
        this.updatedAt = Instant.now();
    }
}
