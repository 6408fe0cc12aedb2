package de.htwsaar.assetserver.core.service;

import de.htwsaar.assetserver.core.domain.AssetFile;
import de.htwsaar.assetserver.core.domain.AssetFileSystem;
import de.htwsaar.assetserver.core.domain.AssetStat;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dateibaum im Speicher für Loader-Tests. Ein geöffnetes Handle sieht den Inhalt zum
 * Öffnungszeitpunkt, die Änderungszeit dagegen immer aktuell (wie bei einem echten Dateisystem
 * nach Ersetzen per Rename).
 */
final class InMemoryAssetFileSystem implements AssetFileSystem {

    private record Entry(byte[] data, Instant modTime, boolean directory) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Set<String> denied = ConcurrentHashMap.newKeySet();
    private final AtomicInteger opens = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private volatile Runnable onOpen = () -> {};
    private volatile Runnable onFirstRead = () -> {};

    void put(String path, String content, Instant modTime) {
        put(path, content.getBytes(StandardCharsets.UTF_8), modTime);
    }

    void put(String path, byte[] content, Instant modTime) {
        entries.put(path, new Entry(content.clone(), modTime, false));
    }

    void mkdir(String path, Instant modTime) {
        entries.put(path, new Entry(new byte[0], modTime, true));
    }

    void remove(String path) {
        entries.remove(path);
    }

    void deny(String path) {
        denied.add(path);
    }

    /** Wird einmalig nach dem nächsten erfolgreichen {@link #open(String)} ausgeführt. */
    void onNextOpen(Runnable hook) {
        onOpen = hook;
    }

    /** Wird einmalig beim ersten Lesen aus dem nächsten Handle ausgeführt. */
    void onNextRead(Runnable hook) {
        onFirstRead = hook;
    }

    int opens() {
        return opens.get();
    }

    int closes() {
        return closes.get();
    }

    @Override
    public AssetStat stat(String path) throws IOException {
        Entry e = lookup(path);
        return new AssetStat(baseName(path), e.data().length, e.modTime(), e.directory());
    }

    @Override
    public AssetFile open(String path) throws IOException {
        Entry e = lookup(path);
        opens.incrementAndGet();
        Runnable readHook = onFirstRead;
        onFirstRead = () -> {};
        AssetFile file = new MemoryFile(path, e.data(), readHook);
        Runnable hook = onOpen;
        onOpen = () -> {};
        hook.run();
        return file;
    }

    private Entry lookup(String path) throws IOException {
        if (denied.contains(path)) {
            throw new AccessDeniedException(path);
        }
        Entry e = entries.get(path);
        if (e == null) {
            throw new NoSuchFileException(path);
        }
        return e;
    }

    private static String baseName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private final class MemoryFile implements AssetFile {

        private final String path;
        private final ByteArrayChannel channel;

        MemoryFile(String path, byte[] data, Runnable readHook) {
            this.path = path;
            this.channel = new ByteArrayChannel(data, readHook);
        }

        @Override
        public AssetStat stat() throws IOException {
            Entry current = lookup(path);
            return new AssetStat(baseName(path), channel.size(), current.modTime(), current.directory());
        }

        @Override
        public SeekableByteChannel channel() {
            return channel;
        }

        @Override
        public void close() {
            if (channel.isOpen()) {
                closes.incrementAndGet();
            }
            channel.close();
        }
    }

    /** Nur-Lese-Kanal über ein Byte-Array. */
    static final class ByteArrayChannel implements SeekableByteChannel {

        private final byte[] data;
        private Runnable readHook;
        private long position;
        private boolean open = true;

        ByteArrayChannel(byte[] data, Runnable readHook) {
            this.data = data;
            this.readHook = readHook;
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            ensureOpen();
            if (readHook != null) {
                Runnable hook = readHook;
                readHook = null;
                hook.run();
            }
            if (position >= data.length) {
                return -1;
            }
            int n = (int) Math.min(dst.remaining(), data.length - position);
            dst.put(data, (int) position, n);
            position += n;
            return n;
        }

        @Override
        public int write(ByteBuffer src) {
            throw new NonWritableChannelException();
        }

        @Override
        public long position() throws IOException {
            ensureOpen();
            return position;
        }

        @Override
        public SeekableByteChannel position(long newPosition) throws IOException {
            ensureOpen();
            position = newPosition;
            return this;
        }

        @Override
        public long size() throws IOException {
            ensureOpen();
            return data.length;
        }

        @Override
        public SeekableByteChannel truncate(long size) {
            throw new NonWritableChannelException();
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }

        private void ensureOpen() throws ClosedChannelException {
            if (!open) {
                throw new ClosedChannelException();
            }
        }
    }
}
