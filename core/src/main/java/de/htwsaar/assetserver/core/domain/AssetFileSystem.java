package de.htwsaar.assetserver.core.domain;

import java.io.IOException;

/**
 * Port zum read-only Dateibaum, aus dem Assets ausgeliefert werden.
 *
 * <p>Pfade sind logisch: relativ, durch {@code /} getrennt, ohne führenden Slash.
 * Fehlende Dateien werden als {@link java.nio.file.NoSuchFileException} gemeldet.</p>
 */
public interface AssetFileSystem {

    /**
     * Liest die Metadaten einer Datei ohne sie zu öffnen.
     *
     * @param path logischer Pfad
     * @return Momentaufnahme
     * @throws IOException bei fehlender Datei oder Lesefehlern
     */
    AssetStat stat(String path) throws IOException;

    /**
     * Öffnet eine Datei zum Lesen.
     *
     * @param path logischer Pfad
     * @return offenes Handle, vom Aufrufer zu schließen
     * @throws IOException bei fehlender Datei oder Lesefehlern
     */
    AssetFile open(String path) throws IOException;
}
