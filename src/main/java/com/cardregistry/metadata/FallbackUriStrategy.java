package com.cardregistry.metadata;

/**
 * Produces the URI of a card whose level has no URI registered.
 */
public interface FallbackUriStrategy {

    String fallbackUri(long cardId, String baseUri);
}
