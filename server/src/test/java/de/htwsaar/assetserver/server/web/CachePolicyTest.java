package de.htwsaar.assetserver.server.web;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CachePolicyTest {

    @Test
    void shouldSelectByTagState() {
        CachePolicy policy = new CachePolicy(false);
        assertEquals("public, max-age=60", policy.select(false));
        assertEquals("public, max-age=31536000, immutable", policy.select(true));
    }

    @Test
    void noCacheShouldWinOverBoth() {
        CachePolicy policy = new CachePolicy(true);
        assertEquals("no-cache", policy.select(false));
        assertEquals("no-cache", policy.select(true));
    }
}
