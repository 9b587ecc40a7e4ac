package com.cardregistry.governance;

/**
 * Capabilities that gate registry operations.
 */
public enum Capability {
    /**
     * May mint new cards.
     */
    MINTER,

    /**
     * May consume uses on any card.
     */
    OPERATOR,

    /**
     * May change limits, metadata, capability grants and maintenance mode.
     */
    ADMIN
}
