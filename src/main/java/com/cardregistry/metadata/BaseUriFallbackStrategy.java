package com.cardregistry.metadata;

import org.springframework.stereotype.Component;

/**
 * Default fallback: base URI followed by the card identifier, or nothing without a base URI.
 */
@Component
public class BaseUriFallbackStrategy implements FallbackUriStrategy {

    @Override
    public String fallbackUri(long cardId, String baseUri) {
        if (baseUri == null || baseUri.isEmpty()) {
            return "";
        }
        return baseUri + cardId;
    }
}
