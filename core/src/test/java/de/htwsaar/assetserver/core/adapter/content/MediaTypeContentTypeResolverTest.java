package de.htwsaar.assetserver.core.adapter.content;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class MediaTypeContentTypeResolverTest {

    private final MediaTypeContentTypeResolver resolver = new MediaTypeContentTypeResolver();

    @Test
    void textTypesShouldGetUtf8Charset() {
        String css = resolver.byName("style.css");
        assertNotNull(css);
        assertTrue(css.startsWith("text/css"));
        assertTrue(css.toLowerCase().contains("charset=utf-8"));
    }

    @Test
    void binaryTypesShouldStayWithoutCharset() {
        assertEquals("image/png", resolver.byName("logo.png"));
    }

    @Test
    void unknownOrMissingExtensionShouldBeNull() {
        assertNull(resolver.byName("noext"));
        assertNull(resolver.byName("file.unknownext123"));
        assertNull(resolver.byName(null));
    }

    @Test
    void sniffShouldRecognizeHtmlWithUtf8Charset() {
        assertEquals("text/html;charset=UTF-8", sniff("<!doctype html>\n"));
        assertTrue(sniff("<html><body>hi</body></html>").startsWith("text/html"));
    }

    @Test
    void sniffShouldRecognizeDocumentsByMagicNumber() {
        assertEquals("application/pdf", sniff("%PDF-1.4\n"));
        assertEquals("image/gif", sniff("GIF89a\u0001\u0000\u0001\u0000"));
    }

    @Test
    void sniffShouldRecognizeImagesAndArchives() {
        assertEquals("image/png", resolver.sniff(new byte[] {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D}));
        assertEquals("image/jpeg", resolver.sniff(new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10}));
        assertTrue(resolver.sniff(new byte[] {0x1F, (byte) 0x8B, 0x08, 0, 0, 0}).contains("gzip"));
    }

    @Test
    void sniffShouldFallBackToPlainTextOrBinary() {
        assertTrue(sniff("hello world\n").startsWith("text/plain"));
        assertEquals("application/octet-stream", resolver.sniff(new byte[] {1, 2, 3, 0, 0, (byte) 0xFE, 0, 7}));
    }

    @Test
    void sniffShouldOnlyLookAtTheFirst512Bytes() {
        byte[] data = new byte[600];
        Arrays.fill(data, (byte) 'a');
        Arrays.fill(data, 520, 600, (byte) 0);

        assertTrue(resolver.sniff(data).startsWith("text/plain"));
    }

    private String sniff(String s) {
        return resolver.sniff(s.getBytes(StandardCharsets.ISO_8859_1));
    }
}
