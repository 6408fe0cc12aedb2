package de.htwsaar.assetserver.core.service;

import de.htwsaar.assetserver.common.util.Sha256Util;
import de.htwsaar.assetserver.core.cache.FileInfoCache;
import de.htwsaar.assetserver.core.domain.AssetFile;
import de.htwsaar.assetserver.core.domain.AssetFileSystem;
import de.htwsaar.assetserver.core.domain.AssetStat;
import de.htwsaar.assetserver.core.domain.CacheDecision;
import de.htwsaar.assetserver.core.domain.ContentTypeResolver;
import de.htwsaar.assetserver.core.domain.FileInfo;
import de.htwsaar.assetserver.core.domain.ResolvedAsset;
import de.htwsaar.assetserver.core.tag.TagCodec;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.file.NoSuchFileException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lädt Assets und hält den {@link FileInfoCache} aktuell.
 *
 * <p>Einziger Synchronisationspunkt für beliebig viele parallele Requests. Datei-I/O und Hashing
 * laufen vollständig auf dem aufrufenden Thread, nie unter einem Lock. Zwei Requests, die
 * gleichzeitig einen veralteten Eintrag sehen, berechnen beide neu; veröffentlicht wird per
 * Ersetzen.</p>
 *
 * <p>Ein neu berechneter Eintrag wird nur veröffentlicht, wenn Größe und Änderungszeit vor dem
 * Öffnen, nach dem Öffnen und nach dem Hashen übereinstimmen. So beschreibt jeder Cache-Eintrag
 * genau die Bytes, aus denen sein Tag stammt.</p>
 */
public class AssetLoader {

    private static final Logger log = LoggerFactory.getLogger(AssetLoader.class);

    private static final int BUFFER_SIZE = 8192;

    private final AssetFileSystem fileSystem;
    private final ContentTypeResolver contentTypes;
    private final FileInfoCache cache;

    /**
     * @param fileSystem   Dateibaum (darf nicht {@code null} sein)
     * @param contentTypes Content-Type-Ermittlung (darf nicht {@code null} sein)
     * @param cache        Cache dieser Server-Instanz (darf nicht {@code null} sein)
     */
    public AssetLoader(AssetFileSystem fileSystem, ContentTypeResolver contentTypes, FileInfoCache cache) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem must not be null");
        this.contentTypes = Objects.requireNonNull(contentTypes, "contentTypes must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /**
     * Liefert gültige Metadaten einer Datei. Passt der Cache-Eintrag zum aktuellen Stat,
     * wird die Datei weder geöffnet noch gelesen.
     *
     * @param path logischer Pfad
     * @return gültige Metadaten
     * @throws AssetNotFoundException wenn die Datei fehlt oder ein Verzeichnis ist
     * @throws AssetAccessException   bei sonstigen I/O-Fehlern
     */
    public FileInfo info(String path) {
        AssetStat stat = statFile(path);
        FileInfo cached = cache.get(path);
        if (cached != null && cached.matches(stat)) {
            return cached;
        }
        try (ResolvedAsset asset = load(path, stat)) {
            return asset.info();
        } catch (IOException e) {
            throw translate(path, e);
        }
    }

    /**
     * Löst eine Datei zum Ausliefern auf: gültige Metadaten plus offenes, zurückgespultes Handle.
     *
     * @param path logischer Pfad
     * @return aufgelöstes Asset, vom Aufrufer zu schließen
     * @throws AssetNotFoundException wenn die Datei fehlt oder ein Verzeichnis ist
     * @throws AssetAccessException   bei sonstigen I/O-Fehlern
     */
    public ResolvedAsset resolve(String path) {
        return load(path, statFile(path));
    }

    private AssetStat statFile(String path) {
        AssetStat stat;
        try {
            stat = fileSystem.stat(path);
        } catch (IOException e) {
            throw translate(path, e);
        }
        if (stat.directory()) {
            throw new AssetNotFoundException(path);
        }
        return stat;
    }

    private ResolvedAsset load(String path, AssetStat before) {
        AssetFile file;
        try {
            file = fileSystem.open(path);
        } catch (IOException e) {
            throw translate(path, e);
        }

        try {
            AssetStat opened = file.stat();
            // zwischen Stat und Open kann ein Verzeichnis an die Stelle getreten sein
            if (opened.directory()) {
                throw new AssetNotFoundException(path);
            }
            boolean stable = before.sameState(opened);

            FileInfo cached = cache.get(path);
            if (stable && cached != null && cached.matches(opened)) {
                return new ResolvedAsset(path, cached, file, CacheDecision.HIT);
            }

            FileInfo fresh = readInfo(file, opened);
            file.channel().position(0);
            if (stable && unchangedSince(path, opened)) {
                cache.publish(path, fresh);
                log.debug("Recomputed asset info for '{}': tag={} size={}", path, fresh.tag(), fresh.size());
                return new ResolvedAsset(path, fresh, file, CacheDecision.MISS);
            }
            // die Änderungszeit kann schon zur neuen Version gehören, die Bytes nicht
            log.debug("Asset '{}' changed while being hashed, serving without caching", path);
            return new ResolvedAsset(path, fresh, file, CacheDecision.UNSTABLE);
        } catch (IOException e) {
            closeAfterFailure(file, e);
            throw translate(path, e);
        } catch (RuntimeException e) {
            closeAfterFailure(file, e);
            throw e;
        }
    }

    /**
     * Hasht den gesamten Inhalt und bestimmt dabei den Content-Type. Bei unbekannter Endung werden
     * höchstens {@link ContentTypeResolver#SNIFF_LENGTH} Bytes für die Signatur-Erkennung gepuffert.
     */
    private FileInfo readInfo(AssetFile file, AssetStat stat) throws IOException {
        MessageDigest md = Sha256Util.newDigest();
        String contentType = contentTypes.byName(stat.name());
        byte[] sniffBuf = contentType == null ? new byte[ContentTypeResolver.SNIFF_LENGTH] : null;
        int sniffLen = 0;

        file.channel().position(0);
        // Stream nicht schließen: er würde das Handle mitschließen
        InputStream in = Channels.newInputStream(file.channel());
        byte[] buf = new byte[BUFFER_SIZE];
        int n;
        while ((n = in.read(buf)) != -1) {
            md.update(buf, 0, n);
            if (sniffBuf != null && sniffLen < sniffBuf.length) {
                int take = Math.min(n, sniffBuf.length - sniffLen);
                System.arraycopy(buf, 0, sniffBuf, sniffLen, take);
                sniffLen += take;
            }
        }
        if (sniffBuf != null) {
            contentType = contentTypes.sniff(Arrays.copyOf(sniffBuf, sniffLen));
        }
        return new FileInfo(stat.modTime(), stat.size(), TagCodec.encode(md.digest()), contentType);
    }

    private boolean unchangedSince(String path, AssetStat opened) throws IOException {
        try {
            return opened.sameState(fileSystem.stat(path));
        } catch (NoSuchFileException | FileNotFoundException e) {
            return false;
        }
    }

    private static void closeAfterFailure(AssetFile file, Exception failure) {
        try {
            file.close();
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private static AssetException translate(String path, IOException e) {
        if (e instanceof NoSuchFileException || e instanceof FileNotFoundException) {
            return new AssetNotFoundException(path, e);
        }
        log.warn("I/O error while loading asset '{}'", path, e);
        return new AssetAccessException(path, e);
    }
}
