package de.htwsaar.assetserver.core.cache;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.assetserver.core.domain.AssetStat;
import de.htwsaar.assetserver.core.domain.FileInfo;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class FileInfoCacheTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void getShouldNotCreateHolder() {
        FileInfoCache cache = new FileInfoCache();
        assertNull(cache.get("a.js"));
        assertEquals(0, cache.size());
    }

    @Test
    void publishShouldReplaceWholeEntry() {
        FileInfoCache cache = new FileInfoCache();
        FileInfo first = new FileInfo(T0, 4, "sI22qapGJ0", "text/javascript");
        FileInfo second = new FileInfo(T0.plusSeconds(1), 2, "xGDKjHWNmW", "text/javascript");

        cache.publish("a.js", first);
        cache.publish("a.js", second);

        assertSame(second, cache.get("a.js"));
        assertEquals(1, cache.size());
    }

    @Test
    void holderShouldBePermanentPerPath() {
        FileInfoCache cache = new FileInfoCache();
        AtomicReference<FileInfo> holder = cache.holder("a.js");
        cache.publish("a.js", new FileInfo(T0, 1, "0000000000", null));

        assertSame(holder, cache.holder("a.js"));
        assertNotNull(holder.get());
    }

    @Test
    void entryShouldMatchOnlySameSizeAndModTime() {
        FileInfo info = new FileInfo(T0, 4, "sI22qapGJ0", null);

        assertTrue(info.matches(new AssetStat("a.js", 4, T0, false)));
        assertFalse(info.matches(new AssetStat("a.js", 5, T0, false)));
        assertFalse(info.matches(new AssetStat("a.js", 4, T0.plusNanos(1), false)));
        assertFalse(info.matches(new AssetStat("a.js", 4, T0, true)));
        assertFalse(info.matches(null));
    }
}
