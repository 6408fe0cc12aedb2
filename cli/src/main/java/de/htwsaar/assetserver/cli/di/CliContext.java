package de.htwsaar.assetserver.cli.di;

import de.htwsaar.assetserver.core.AssetServer;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Aufgaben:
 * - Bündelt die Ausgabekanäle (stdout/stderr).
 * - Stellt die Fabrik für Asset-Server bereit (ein Server pro Wurzelverzeichnis).
 * - Ermöglicht testbare Commands durch Constructor Injection statt statischer Globals.
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final Function<Path, AssetServer> serverFactory;

    /**
     * Erzeugt einen neuen CLI-Kontext.
     *
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param serverFactory erzeugt einen Asset-Server für ein Wurzelverzeichnis
     */
    public CliContext(PrintWriter out, PrintWriter err, Function<Path, AssetServer> serverFactory) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.serverFactory = Objects.requireNonNull(serverFactory);
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    /**
     * @param root Wurzelverzeichnis
     * @return Asset-Server mit frischem Cache
     */
    public AssetServer serverFor(Path root) {
        return serverFactory.apply(root);
    }
}
