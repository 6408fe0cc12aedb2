package de.htwsaar.assetserver.core;

import de.htwsaar.assetserver.core.adapter.content.MediaTypeContentTypeResolver;
import de.htwsaar.assetserver.core.adapter.fs.LocalAssetFileSystem;
import de.htwsaar.assetserver.core.cache.FileInfoCache;
import de.htwsaar.assetserver.core.domain.AssetFileSystem;
import de.htwsaar.assetserver.core.domain.ContentTypeResolver;
import de.htwsaar.assetserver.core.domain.FileInfo;
import de.htwsaar.assetserver.core.domain.ResolvedAsset;
import de.htwsaar.assetserver.core.service.AssetLoader;
import de.htwsaar.assetserver.core.service.AssetNotFoundException;
import de.htwsaar.assetserver.core.tag.TagCodec;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Asset-Server über genau einen Dateibaum.
 *
 * <p>Besitzt seinen eigenen {@link FileInfoCache}; mehrere Instanzen über verschiedene Bäume
 * teilen keinen Zustand. Lebensdauer des Caches = Lebensdauer der Instanz.</p>
 */
public class AssetServer {

    private final FileInfoCache cache = new FileInfoCache();
    private final AssetLoader loader;

    /**
     * @param fileSystem   Dateibaum (darf nicht {@code null} sein)
     * @param contentTypes Content-Type-Ermittlung (darf nicht {@code null} sein)
     */
    public AssetServer(AssetFileSystem fileSystem, ContentTypeResolver contentTypes) {
        this.loader = new AssetLoader(fileSystem, contentTypes, cache);
    }

    /**
     * Asset-Server über ein lokales Verzeichnis mit der Standard-Content-Type-Ermittlung.
     *
     * @param root Wurzelverzeichnis
     * @return neue Instanz mit leerem Cache
     */
    public static AssetServer forDirectory(Path root) {
        return new AssetServer(new LocalAssetFileSystem(root), new MediaTypeContentTypeResolver());
    }

    /**
     * Erzeugt den getaggten Pfad einer Datei, z. B. für Links in Templates.
     * Ein führender Slash bleibt erhalten: {@code /d/style.css} → {@code /d/style.TAG.css}.
     *
     * @param path Pfad der Datei ohne Tag
     * @return getaggter Pfad
     * @throws AssetNotFoundException wenn die Datei fehlt oder ein Verzeichnis ist
     * @throws de.htwsaar.assetserver.core.service.AssetAccessException bei sonstigen I/O-Fehlern
     */
    public String tag(String path) {
        Objects.requireNonNull(path, "path must not be null");
        FileInfo info = loader.info(logicalPath(path));
        return TagCodec.insertTag(path, info.tag());
    }

    /**
     * Liefert gültige Metadaten einer Datei, im Normalfall ohne sie zu öffnen.
     *
     * @param path Pfad ohne Tag, optional mit führendem Slash
     * @return Metadaten
     */
    public FileInfo info(String path) {
        Objects.requireNonNull(path, "path must not be null");
        return loader.info(logicalPath(path));
    }

    /**
     * Löst eine Datei zum Ausliefern auf.
     *
     * @param path logischer Pfad ohne Tag
     * @return aufgelöstes Asset, vom Aufrufer zu schließen
     */
    public ResolvedAsset resolve(String path) {
        Objects.requireNonNull(path, "path must not be null");
        return loader.resolve(logicalPath(path));
    }

    /**
     * Anzahl der Pfade, für die jemals ein Cache-Eintrag angelegt wurde.
     *
     * @return Eintragsanzahl
     */
    public int cachedEntries() {
        return cache.size();
    }

    private static String logicalPath(String path) {
        String p = path;
        while (p.startsWith("/")) p = p.substring(1);
        if (p.isEmpty()) {
            throw new AssetNotFoundException(path);
        }
        return p;
    }
}
