package de.htwsaar.assetserver.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Gecachte Metadaten eines Assets.
 *
 * <p>Gültig für einen Dateizustand genau dann, wenn Größe und Änderungszeit übereinstimmen
 * ({@link #matches(AssetStat)}); andernfalls muss der Eintrag neu berechnet werden.</p>
 *
 * @param modTime     Änderungszeitpunkt beim Berechnen
 * @param size        Größe beim Berechnen
 * @param tag         Tag des Inhalts-Digests
 * @param contentType Content-Type oder {@code null}, wenn unbekannt
 */
public record FileInfo(Instant modTime, long size, String tag, String contentType) {

    public FileInfo {
        Objects.requireNonNull(modTime, "modTime must not be null");
        Objects.requireNonNull(tag, "tag must not be null");
    }

    public boolean matches(AssetStat stat) {
        return stat != null && !stat.directory() && size == stat.size() && modTime.equals(stat.modTime());
    }
}
