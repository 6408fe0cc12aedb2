package de.htwsaar.assetserver.core.adapter.fs;

import de.htwsaar.assetserver.core.domain.AssetFile;
import de.htwsaar.assetserver.core.domain.AssetFileSystem;
import de.htwsaar.assetserver.core.domain.AssetStat;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Dateibaum-Adapter auf ein lokales Verzeichnis (java.nio).
 *
 * <p>Logische Pfade werden strikt auf das Wurzelverzeichnis beschränkt: leere Segmente,
 * {@code .}/{@code ..}, Backslashes, NUL und absolute Pfade gelten als nicht vorhanden.</p>
 */
public final class LocalAssetFileSystem implements AssetFileSystem {

    private final Path root;

    /**
     * @param root Wurzelverzeichnis (darf nicht {@code null} sein)
     */
    public LocalAssetFileSystem(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public AssetStat stat(String path) throws IOException {
        Path file = resolve(path);
        BasicFileAttributes attrs = readAttributes(file, path);
        return new AssetStat(baseName(file), attrs.size(), attrs.lastModifiedTime().toInstant(), attrs.isDirectory());
    }

    @Override
    public AssetFile open(String path) throws IOException {
        Path file = resolve(path);
        if (Files.isDirectory(file)) {
            throw new NoSuchFileException(path, null, "is a directory");
        }
        SeekableByteChannel channel;
        try {
            channel = Files.newByteChannel(file, StandardOpenOption.READ);
        } catch (FileSystemException e) {
            throw notUnderFile(file, path, e);
        }
        return new LocalAssetFile(file, path, channel);
    }

    static boolean isValidPath(String path) {
        if (path == null || path.isEmpty() || path.indexOf('\\') >= 0 || path.indexOf('\0') >= 0) {
            return false;
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    private Path resolve(String path) throws NoSuchFileException {
        if (!isValidPath(path)) {
            throw new NoSuchFileException(path);
        }
        Path file;
        try {
            file = root.resolve(path).normalize();
        } catch (InvalidPathException e) {
            throw new NoSuchFileException(path);
        }
        if (!file.startsWith(root) || file.equals(root)) {
            throw new NoSuchFileException(path);
        }
        return file;
    }

    private BasicFileAttributes readAttributes(Path file, String path) throws IOException {
        try {
            return Files.readAttributes(file, BasicFileAttributes.class);
        } catch (FileSystemException e) {
            throw notUnderFile(file, path, e);
        }
    }

    /**
     * "a.js/x" scheitert mit ENOTDIR statt ENOENT; das ist fachlich ein fehlender Pfad.
     */
    private FileSystemException notUnderFile(Path file, String path, FileSystemException e) {
        if (e instanceof NoSuchFileException || e instanceof AccessDeniedException) {
            return e;
        }
        for (Path parent = file.getParent(); parent != null && parent.startsWith(root); parent = parent.getParent()) {
            if (Files.isRegularFile(parent)) {
                NoSuchFileException notFound = new NoSuchFileException(path, null, "parent is not a directory");
                notFound.initCause(e);
                return notFound;
            }
        }
        return e;
    }

    private static String baseName(Path file) {
        Path name = file.getFileName();
        return name != null ? name.toString() : "";
    }

    /** Offenes Handle; Stat-Größe kommt aus dem Kanal, Zeit und Typ aus dem Pfad. */
    private static final class LocalAssetFile implements AssetFile {

        private final Path file;
        private final String path;
        private final SeekableByteChannel channel;

        LocalAssetFile(Path file, String path, SeekableByteChannel channel) {
            this.file = file;
            this.path = path;
            this.channel = channel;
        }

        @Override
        public AssetStat stat() throws IOException {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(file, BasicFileAttributes.class);
            } catch (NoSuchFileException e) {
                throw new NoSuchFileException(path, null, "removed after open");
            }
            return new AssetStat(
                    baseName(file), channel.size(), attrs.lastModifiedTime().toInstant(), attrs.isDirectory());
        }

        @Override
        public SeekableByteChannel channel() {
            return channel;
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}
