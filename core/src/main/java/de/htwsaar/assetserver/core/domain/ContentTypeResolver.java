package de.htwsaar.assetserver.core.domain;

/**
 * Port zur Ermittlung des Content-Types eines Assets.
 */
public interface ContentTypeResolver {

    /** Maximale Anzahl Bytes, die {@link #sniff(byte[])} ausgewertet bekommt. */
    int SNIFF_LENGTH = 512;

    /**
     * Content-Type anhand des Dateinamens.
     *
     * @param fileName Basisname der Datei
     * @return Content-Type oder {@code null} bei unbekannter Endung
     */
    String byName(String fileName);

    /**
     * Content-Type anhand der ersten Bytes des Inhalts (Signatur-Erkennung).
     *
     * @param prefix höchstens {@link #SNIFF_LENGTH} Bytes vom Dateianfang
     * @return Content-Type oder {@code null}, wenn nicht bestimmbar
     */
    String sniff(byte[] prefix);
}
