package de.htwsaar.assetserver.server.web;

import de.htwsaar.assetserver.core.domain.CacheDecision;
import de.htwsaar.assetserver.core.domain.ResolvedAsset;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.core.io.AbstractResource;

/**
 * Spring-{@link org.springframework.core.io.Resource} über ein aufgelöstes Asset.
 *
 * <p>Im Gegensatz zu {@code InputStreamResource} mehrfach lesbar und mit bekannter Länge, damit
 * Spring Byte-Ranges (206) bedienen kann. Die Länge stammt aus denselben Metadaten wie der Tag.</p>
 */
final class AssetResource extends AbstractResource {

    private final ResolvedAsset asset;
    private final String filename;

    AssetResource(ResolvedAsset asset, String filename) {
        this.asset = asset;
        this.filename = filename;
    }

    @Override
    public InputStream getInputStream() throws IOException {
        return asset.openStream();
    }

    @Override
    public long contentLength() {
        return asset.info().size();
    }

    @Override
    public long lastModified() throws IOException {
        if (asset.cache() == CacheDecision.UNSTABLE) {
            throw new FileNotFoundException("no reliable modification time for " + getDescription());
        }
        return asset.info().modTime().toEpochMilli();
    }

    @Override
    public String getFilename() {
        return filename;
    }

    @Override
    public boolean exists() {
        return true;
    }

    @Override
    public boolean isReadable() {
        return true;
    }

    @Override
    public String getDescription() {
        return "asset [" + asset.path() + "]";
    }
}
