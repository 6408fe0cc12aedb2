package de.htwsaar.assetserver.core.adapter.content;

import de.htwsaar.assetserver.core.domain.ContentTypeResolver;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import org.apache.tika.Tika;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * Content-Type über Springs {@link MediaTypeFactory} (Dateiendung) und Apache Tika
 * (Signatur-Erkennung am Dateianfang). Textuelle Typen ohne Charset bekommen {@code charset=UTF-8}.
 */
public class MediaTypeContentTypeResolver implements ContentTypeResolver {

    // Tika ist threadsicher
    private final Tika tika = new Tika();

    @Override
    public String byName(String fileName) {
        if (fileName == null || fileName.lastIndexOf('.') < 0) {
            return null;
        }
        Optional<MediaType> type = MediaTypeFactory.getMediaType(fileName);
        return type.map(MediaTypeContentTypeResolver::withTextCharset).orElse(null);
    }

    /**
     * Erkennt den Typ nur anhand der übergebenen Bytes, ohne Dateinamen.
     * Nicht erkennbare Binärdaten ergeben {@code application/octet-stream}.
     */
    @Override
    public String sniff(byte[] prefix) {
        byte[] head = prefix.length > SNIFF_LENGTH ? Arrays.copyOf(prefix, SNIFF_LENGTH) : prefix;
        String detected = tika.detect(head);
        try {
            return withTextCharset(MediaType.parseMediaType(detected));
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM_VALUE;
        }
    }

    private static String withTextCharset(MediaType mt) {
        if (mt.getCharset() == null && isTextual(mt)) {
            mt = new MediaType(mt, StandardCharsets.UTF_8);
        }
        return mt.toString();
    }

    private static boolean isTextual(MediaType mt) {
        if ("text".equals(mt.getType())) {
            return true;
        }
        String sub = mt.getSubtype();
        return "application".equals(mt.getType())
                && ("javascript".equals(sub)
                        || "json".equals(sub)
                        || "xml".equals(sub)
                        || sub.endsWith("+json")
                        || sub.endsWith("+xml"));
    }
}
