package de.htwsaar.assetserver.server.web;

/**
 * Wählt den {@code Cache-Control}-Header einer erfolgreichen Antwort.
 */
public final class CachePolicy {

    /** Ungetaggte URLs: kurz cachen, danach per ETag revalidieren. */
    public static final String SHORT = "public, max-age=60";

    /** Getaggte URLs ändern ihren Inhalt nie. */
    public static final String IMMUTABLE = "public, max-age=31536000, immutable";

    public static final String NO_CACHE = "no-cache";

    private final boolean noCache;

    public CachePolicy(boolean noCache) {
        this.noCache = noCache;
    }

    /**
     * @param tagged {@code true}, wenn die URL einen passenden Tag trug
     * @return Header-Wert
     */
    public String select(boolean tagged) {
        if (noCache) return NO_CACHE;
        return tagged ? IMMUTABLE : SHORT;
    }

    public boolean noCache() {
        return noCache;
    }
}
