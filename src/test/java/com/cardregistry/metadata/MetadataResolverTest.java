package com.cardregistry.metadata;

import com.cardregistry.common.exception.CardNotFoundException;
import com.cardregistry.state.CardStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MetadataResolver.
 */
@ExtendWith(MockitoExtension.class)
class MetadataResolverTest {

    @Mock
    private LevelUriCatalog levelUriCatalog;

    @Mock
    private CardStateStore cardStateStore;

    private MetadataResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new MetadataResolver(levelUriCatalog, cardStateStore, new BaseUriFallbackStrategy(), "");
    }

    @Test
    void testResolveBranches() {
        assertEquals("https://cdn/ipfs://X", MetadataResolver.resolve("ipfs://X", "fallback", "https://cdn/"));
        assertEquals("ipfs://X", MetadataResolver.resolve("ipfs://X", "fallback", ""));
        assertEquals("fallback", MetadataResolver.resolve("", "fallback", "https://cdn/"));
        assertEquals("fallback", MetadataResolver.resolve(null, "fallback", null));
    }

    @Test
    void testCardUriWithLevelUriAndBase() {
        when(cardStateStore.levelOf(7L)).thenReturn(BigInteger.TWO);
        when(levelUriCatalog.uriOf(BigInteger.TWO)).thenReturn("ipfs://X");
        resolver.setBaseUri("https://cdn/");

        assertEquals("https://cdn/ipfs://X", resolver.cardUri(7L));
    }

    @Test
    void testCardUriFallsBackToBasePlusId() {
        when(cardStateStore.levelOf(7L)).thenReturn(BigInteger.TWO);
        when(levelUriCatalog.uriOf(BigInteger.TWO)).thenReturn("");
        resolver.setBaseUri("https://cdn/cards/");

        assertEquals("https://cdn/cards/7", resolver.cardUri(7L));
    }

    @Test
    void testCardUriWithoutAnything() {
        when(cardStateStore.levelOf(7L)).thenReturn(BigInteger.TWO);
        when(levelUriCatalog.uriOf(BigInteger.TWO)).thenReturn("");

        assertEquals("", resolver.cardUri(7L));
    }

    @Test
    void testCardUriOfMissingCard() {
        when(cardStateStore.levelOf(7L)).thenThrow(new CardNotFoundException(7L));

        assertThrows(CardNotFoundException.class, () -> resolver.cardUri(7L));
        verifyNoInteractions(levelUriCatalog);
    }

    @Test
    void testNullBaseUriIsEmpty() {
        resolver.setBaseUri(null);

        assertEquals("", resolver.getBaseUri());
    }
}
