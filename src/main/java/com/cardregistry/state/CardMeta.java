package com.cardregistry.state;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Mutable attributes of a card: its use counter and its level.
 *
 * The level is written once at mint and has no setter. Uses only grow, through
 * {@link #addUses(BigInteger)}, until the card is burned and the row is deleted.
 */
@Entity
@Table(name = "card_meta")
@Data
@NoArgsConstructor
public class CardMeta {

    @Id
    private Long cardId;

    @Column(name = "use_count", nullable = false, precision = 39, scale = 0)
    @Setter(AccessLevel.NONE)
    private BigInteger uses;

    @Column(name = "card_level", nullable = false, updatable = false, precision = 39, scale = 0)
    @Setter(AccessLevel.NONE)
    private BigInteger level;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public CardMeta(long cardId, BigInteger level) {
        this.cardId = cardId;
        this.uses = BigInteger.ZERO;
        this.level = level;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public BigInteger addUses(BigInteger count) {
        this.uses = this.uses.add(count);
        this.updatedAt = Instant.now();
        return this.uses;
    }
}
