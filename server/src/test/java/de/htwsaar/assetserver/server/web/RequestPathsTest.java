package de.htwsaar.assetserver.server.web;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RequestPathsTest {

    @ParameterizedTest
    @CsvSource({
        "/a.js,              /a.js",
        "/d//style.css,      /d/style.css",
        "/d/./style.css,     /d/style.css",
        "/xyz/../a.js,       /a.js",
        "/../../a.js,        /a.js",
        "/d/style.css/,      /d/style.css/",
        "/xyz/../a.js/,      /a.js/",
        "/,                  /",
        "//,                 /",
        "/d/..,              /",
        "/d/../,             /",
    })
    void canonicalize_shouldResolveDotsAndCollapseSlashes(String in, String expected) {
        assertEquals(expected, RequestPaths.canonicalize(in));
    }

    @Test
    void canonicalize_shouldRejectRelativePaths() {
        assertNull(RequestPaths.canonicalize("a.js"));
        assertNull(RequestPaths.canonicalize(""));
        assertNull(RequestPaths.canonicalize(null));
    }

    @Test
    void redirectLocation_shouldPointToBaseNameRelative() {
        assertEquals("../style.css", RequestPaths.redirectLocation("/d/style.css/", null));
        assertEquals("../a.js", RequestPaths.redirectLocation("/a.js/", ""));
        assertEquals("../a.js?v=1", RequestPaths.redirectLocation("/a.js/", "v=1"));
    }

    @Test
    void redirectLocation_shouldEncodeBaseName() {
        assertEquals("../my%20file.txt", RequestPaths.redirectLocation("/d/my file.txt/", null));
    }
}
