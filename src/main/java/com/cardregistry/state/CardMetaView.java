package com.cardregistry.state;

import lombok.Value;

import java.math.BigInteger;

/**
 * Read-only snapshot of a card's uses and level.
 */
@Value
public class CardMetaView {
    long cardId;
    BigInteger uses;
    BigInteger level;
}
