package com.cardregistry.common.exception;

/**
 * Thrown when an actor lacks the capability a gated operation requires.
 */
public class CapabilityDeniedException extends CardRegistryException {

    private final String actorId;
    private final String capability;

    public CapabilityDeniedException(String actorId, String capability) {
        super(String.format("Actor %s is missing capability %s", actorId, capability));
        this.actorId = actorId;
        this.capability = capability;
    }

    public String getActorId() {
        return actorId;
    }

    public String getCapability() {
        return capability;
    }
}
