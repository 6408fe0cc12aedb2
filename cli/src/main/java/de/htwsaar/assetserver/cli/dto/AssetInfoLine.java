package de.htwsaar.assetserver.cli.dto;

import java.time.Instant;

/**
 * Eine Ausgabezeile der CLI im JSON-Modus.
 *
 * @param path        angefragter Pfad
 * @param taggedPath  Pfad mit eingefügtem Tag
 * @param tag         Tag des Inhalts
 * @param size        Größe in Bytes
 * @param contentType ermittelter Content-Type, {@code null} wenn unbekannt
 * @param modTime     Änderungszeitpunkt
 */
public record AssetInfoLine(
        String path, String taggedPath, String tag, long size, String contentType, Instant modTime) {}
