package de.htwsaar.assetserver.server.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class AssetServerConfigTest {

    @Test
    void mountPathShouldBeNormalized() {
        assertEquals("/sub", AssetServerConfig.normalizeMountPath("sub"));
        assertEquals("/sub", AssetServerConfig.normalizeMountPath("/sub"));
        assertEquals("/sub", AssetServerConfig.normalizeMountPath("/sub/"));
        assertEquals("/a/b", AssetServerConfig.normalizeMountPath(" /a/b// "));
        assertEquals("", AssetServerConfig.normalizeMountPath("/"));
        assertEquals("", AssetServerConfig.normalizeMountPath(""));
        assertEquals("", AssetServerConfig.normalizeMountPath(null));
    }

    @Test
    void rootIsRequired() {
        assertThrows(NullPointerException.class, () -> new AssetServerConfig(null, false, ""));
        assertEquals("/x", new AssetServerConfig(Path.of("assets"), true, "x/").mountPath());
    }
}
