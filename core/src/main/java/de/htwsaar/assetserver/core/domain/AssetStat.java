package de.htwsaar.assetserver.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Momentaufnahme der Metadaten einer Datei im Asset-Baum.
 *
 * @param name      Basisname der Datei (für die Endungs-Auswertung)
 * @param size      Größe in Bytes
 * @param modTime   Änderungszeitpunkt in der Auflösung des Dateisystems
 * @param directory {@code true} bei Verzeichnissen
 */
public record AssetStat(String name, long size, Instant modTime, boolean directory) {

    public AssetStat {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(modTime, "modTime must not be null");
    }

    /**
     * Vergleicht den Dateizustand (Größe, Änderungszeit, Typ) zweier Momentaufnahmen.
     *
     * @param other andere Momentaufnahme
     * @return {@code true}, wenn beide denselben Zustand beschreiben
     */
    public boolean sameState(AssetStat other) {
        return other != null
                && size == other.size
                && directory == other.directory
                && modTime.equals(other.modTime);
    }
}
