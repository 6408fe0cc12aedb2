package de.htwsaar.assetserver.server.web;

import java.util.ArrayDeque;
import java.util.Deque;
import org.springframework.web.util.UriUtils;

/**
 * Pfad-Hilfsfunktionen des Request-Handlers.
 */
public final class RequestPaths {

    private RequestPaths() {}

    /**
     * Kanonisiert einen dekodierten Request-Pfad: absolut, {@code .}/{@code ..} aufgelöst,
     * mehrfache Slashes zusammengefasst. Ein abschließender Slash bleibt erhalten, damit der
     * Handler darauf mit einem Redirect reagieren kann. {@code ..} oberhalb der Wurzel endet
     * an der Wurzel.
     *
     * @param path dekodierter Pfad
     * @return kanonischer Pfad, beginnt immer mit "/"; {@code null} wenn {@code path} nicht mit "/" beginnt
     */
    public static String canonicalize(String path) {
        if (path == null || !path.startsWith("/")) {
            return null;
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        if (segments.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) sb.append('/').append(segment);
        if (path.endsWith("/")) {
            sb.append('/');
        }
        return sb.toString();
    }

    /**
     * Relatives Redirect-Ziel für einen kanonischen Pfad mit abschließendem Slash:
     * {@code /d/style.css/} → {@code ../style.css}. Relativ, damit es auch unter einem
     * extern abgeschnittenen Präfix stimmt.
     *
     * @param canonicalWithSlash kanonischer Pfad mit abschließendem Slash
     * @param rawQuery           Query-String oder {@code null}
     * @return Wert für den {@code Location}-Header
     */
    public static String redirectLocation(String canonicalWithSlash, String rawQuery) {
        String trimmed = canonicalWithSlash.substring(0, canonicalWithSlash.length() - 1);
        String base = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        String location = "../" + UriUtils.encodePathSegment(base, "UTF-8");
        if (rawQuery != null && !rawQuery.isEmpty()) {
            location += "?" + rawQuery;
        }
        return location;
    }
}
