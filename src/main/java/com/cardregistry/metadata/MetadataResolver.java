package com.cardregistry.metadata;

import com.cardregistry.state.CardStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Renders the display URI of a card from its level.
 *
 * Resolution:
 * 1. No URI for the level: the per-card fallback URI, unchanged
 * 2. Level URI and no base prefix: the level URI verbatim
 * 3. Otherwise: base prefix followed by the level URI
 */
@Service
@Slf4j
public class MetadataResolver {

    private final LevelUriCatalog levelUriCatalog;
    private final CardStateStore cardStateStore;
    private final FallbackUriStrategy fallbackUriStrategy;

    private volatile String baseUri;

    public MetadataResolver(LevelUriCatalog levelUriCatalog,
                            CardStateStore cardStateStore,
                            FallbackUriStrategy fallbackUriStrategy,
                            @Value("${card-registry.metadata.base-uri:}") String baseUri) {
        this.levelUriCatalog = levelUriCatalog;
        this.cardStateStore = cardStateStore;
        this.fallbackUriStrategy = fallbackUriStrategy;
        this.baseUri = baseUri == null ? "" : baseUri;
    }

    public static String resolve(String levelUri, String fallbackUri, String basePrefix) {
        if (levelUri == null || levelUri.isEmpty()) {
            return fallbackUri;
        }
        if (basePrefix == null || basePrefix.isEmpty()) {
            return levelUri;
        }
        return basePrefix + levelUri;
    }

    /**
     * @throws com.cardregistry.common.exception.CardNotFoundException if the card is absent
     */
    @Transactional(readOnly = true)
    public String cardUri(long cardId) {
        BigInteger level = cardStateStore.levelOf(cardId);
        String base = baseUri;
        String uri = resolve(levelUriCatalog.uriOf(level),
            fallbackUriStrategy.fallbackUri(cardId, base), base);
        log.debug("Card {} at level {} resolves to {}", cardId, level, uri);
        return uri;
    }

    public String getBaseUri() {
        return baseUri;
    }

    public void setBaseUri(String baseUri) {
        this.baseUri = baseUri == null ? "" : baseUri;
        log.info("Base URI set to '{}'", this.baseUri);
    }
}
