package de.htwsaar.assetserver.core.domain;

import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.util.Objects;

/**
 * Ergebnis einer Auflösung: gültige Metadaten plus offenes, an den Anfang gespultes Handle.
 *
 * <p>Die Metadaten beschreiben genau die Bytes dieses Handles. Der Aufrufer muss das Asset
 * schließen, sobald die Antwort geschrieben ist.</p>
 */
public final class ResolvedAsset implements Closeable {

    private final String path;
    private final FileInfo info;
    private final AssetFile file;
    private final CacheDecision cache;

    public ResolvedAsset(String path, FileInfo info, AssetFile file, CacheDecision cache) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.info = Objects.requireNonNull(info, "info must not be null");
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /** Logischer Pfad ohne Tag. */
    public String path() {
        return path;
    }

    public FileInfo info() {
        return info;
    }

    public CacheDecision cache() {
        return cache;
    }

    /**
     * Liefert einen Stream ab Dateianfang.
     * Kann mehrfach aufgerufen werden (z. B. für mehrere Byte-Ranges), aber nicht parallel.
     * Schließen des Streams schließt nicht das Handle.
     *
     * @return Stream über den Inhalt
     * @throws IOException wenn das Handle nicht zurückgespult werden kann
     */
    public InputStream openStream() throws IOException {
        file.channel().position(0);
        return new FilterInputStream(Channels.newInputStream(file.channel())) {
            @Override
            public void close() {
                // Handle gehört dem ResolvedAsset
            }
        };
    }

    @Override
    public void close() throws IOException {
        file.close();
    }
}
