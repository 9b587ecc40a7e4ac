package com.cardregistry.governance;

/**
 * Authorization policy consulted by every gated registry operation.
 *
 * The registry never decides who holds a capability; it only asks. Implementations
 * may be backed by a role table, an identity provider or a static allow-list.
 */
public interface CapabilityChecker {

    /**
     * @param actorId the calling account
     * @param capability the capability the operation requires
     * @return true if the actor currently holds the capability
     */
    boolean hasCapability(String actorId, Capability capability);
}
