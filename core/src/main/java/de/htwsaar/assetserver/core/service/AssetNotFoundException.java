package de.htwsaar.assetserver.core.service;

/**
 * Datei fehlt, ist ein Verzeichnis oder ist während der Auflösung verschwunden.
 */
public class AssetNotFoundException extends AssetException {

    public AssetNotFoundException(String path) {
        this(path, null);
    }

    public AssetNotFoundException(String path, Throwable cause) {
        super("Asset not found: " + path, 404, cause);
    }
}
