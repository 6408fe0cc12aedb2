package de.htwsaar.assetserver.cli.command.asset;

import de.htwsaar.assetserver.cli.di.CliContext;
import de.htwsaar.assetserver.core.AssetServer;
import de.htwsaar.assetserver.core.service.AssetException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Gemeinsame Optionen und Fehlerbehandlung der Asset-Commands.
 *
 * <p>Exit-Codes:
 * - 0: OK
 * - 3: Validierungsfehler (Wurzel kein Verzeichnis, leerer Pfad)
 * - 4: mindestens ein Pfad nicht gefunden
 * - 1: interner Fehler (I/O)
 */
abstract class AbstractAssetCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INTERNAL = 1;
    static final int EXIT_VALIDATION = 3;
    static final int EXIT_NOT_FOUND = 4;

    private static final Logger log = LoggerFactory.getLogger(AbstractAssetCommand.class);

    protected final CliContext ctx;

    @Option(
            names = {"-r", "--root"},
            required = true,
            paramLabel = "DIR",
            description = "Wurzelverzeichnis des Asset-Baums")
    private Path root;

    @Option(names = "--json", description = "Ausgabe als JSON-Zeilen")
    protected boolean printJson;

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "Pfade relativ zur Wurzel, z. B. d/style.css")
    private List<String> paths;

    protected AbstractAssetCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        PrintWriter err = ctx.err();
        if (!Files.isDirectory(root)) {
            err.printf("[ASSET] Root is not a directory: %s%n", root);
            err.flush();
            return EXIT_VALIDATION;
        }

        AssetServer server = ctx.serverFor(root);
        int rc = EXIT_OK;
        for (String path : paths) {
            if (path == null || path.isBlank()) {
                err.println("[ASSET] Empty path");
                rc = worse(rc, EXIT_VALIDATION);
                continue;
            }
            try {
                handle(server, path, ctx.out());
            } catch (AssetException ex) {
                boolean notFound = ex.getStatusCode() == 404;
                err.printf("[ASSET] %s: %s%n", path, notFound ? "not found" : "I/O error");
                log.debug("Lookup of '{}' failed", path, ex);
                rc = worse(rc, notFound ? EXIT_NOT_FOUND : EXIT_INTERNAL);
            }
        }
        ctx.out().flush();
        err.flush();
        return rc;
    }

    /**
     * Verarbeitet einen einzelnen Pfad und schreibt die Ausgabezeile.
     *
     * @param server Asset-Server über die Wurzel
     * @param path   Pfad wie angegeben
     * @param out    Ausgabe
     */
    protected abstract void handle(AssetServer server, String path, PrintWriter out);

    /** Interne Fehler wiegen am schwersten, dann Validierung, dann "nicht gefunden". */
    static int worse(int current, int candidate) {
        return rank(candidate) > rank(current) ? candidate : current;
    }

    private static int rank(int code) {
        switch (code) {
            case EXIT_INTERNAL:
                return 3;
            case EXIT_VALIDATION:
                return 2;
            case EXIT_NOT_FOUND:
                return 1;
            default:
                return 0;
        }
    }
}
