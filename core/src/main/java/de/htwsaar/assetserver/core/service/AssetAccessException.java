package de.htwsaar.assetserver.core.service;

import java.io.IOException;

/**
 * Jeder I/O-Fehler außer "existiert nicht" (Rechte, Plattenfehler, ...).
 *
 * <p>Die Nachricht enthält Pfad und Ursache nur fürs Log; nach außen geht sie nie.</p>
 */
public class AssetAccessException extends AssetException {

    public AssetAccessException(String path, IOException cause) {
        super("I/O error while loading asset " + path, 500, cause);
    }
}
