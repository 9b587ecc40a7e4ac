package com.cardregistry.lifecycle;

import lombok.Value;

import java.math.BigInteger;

/**
 * Published after uses are recorded on a card. Carries the headroom left
 * ({@code maxUses - uses}), not the raw counter.
 */
@Value
public class CardUsedEvent {
    long cardId;
    BigInteger remainingUses;
}
