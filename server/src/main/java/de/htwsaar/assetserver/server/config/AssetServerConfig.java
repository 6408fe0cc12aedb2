package de.htwsaar.assetserver.server.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Startkonfiguration des Asset-Servers, zur Laufzeit unveränderlich.
 *
 * @param root      Wurzelverzeichnis des Dateibaums
 * @param noCache   {@code true}: alle Antworten mit {@code Cache-Control: no-cache}
 * @param mountPath externes Pfad-Präfix ohne abschließenden Slash, leer wenn keins
 */
public record AssetServerConfig(Path root, boolean noCache, String mountPath) {

    public AssetServerConfig {
        Objects.requireNonNull(root, "root must not be null");
        mountPath = normalizeMountPath(mountPath);
    }

    /**
     * "sub", "/sub" und "/sub/" werden zu "/sub"; leer oder "/" zu "".
     */
    static String normalizeMountPath(String mountPath) {
        if (mountPath == null) return "";
        String p = mountPath.trim();
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        if (p.isEmpty()) return "";
        return p.startsWith("/") ? p : "/" + p;
    }
}
