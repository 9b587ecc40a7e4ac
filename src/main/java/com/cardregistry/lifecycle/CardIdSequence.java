package com.cardregistry.lifecycle;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-row table holding the identifier the next minted card receives.
 *
 * Advanced in the minting transaction, so a rolled back mint leaves it untouched.
 * It never moves backwards, so identifiers of burned cards are not handed out again.
 */
@Entity
@Table(name = "card_id_sequence")
@Data
@NoArgsConstructor
public class CardIdSequence {

    public static final long ROW_ID = 1L;

    @Id
    private Long id;

    @Column(name = "next_value", nullable = false)
    private long nextValue;

    public CardIdSequence(long nextValue) {
        this.id = ROW_ID;
        this.nextValue = nextValue;
    }

    /**
     * @return the current value, before advancing
     */
    public long getAndIncrement() {
        return nextValue++;
    }
}
