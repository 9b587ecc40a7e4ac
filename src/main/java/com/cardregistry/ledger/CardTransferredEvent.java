package com.cardregistry.ledger;

import lombok.Value;

/**
 * Published on every ownership change. Mint has a null {@code from}, burn a null {@code to}.
 */
@Value
public class CardTransferredEvent {
    String from;
    String to;
    long cardId;

    public boolean isMint() {
        return from == null;
    }

    public boolean isBurn() {
        return to == null;
    }
}
