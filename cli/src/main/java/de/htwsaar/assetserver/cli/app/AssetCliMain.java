package de.htwsaar.assetserver.cli.app;

import de.htwsaar.assetserver.cli.command.root.AssetRootCommand;
import de.htwsaar.assetserver.cli.di.CliContext;
import de.htwsaar.assetserver.cli.di.ContextFactory;
import de.htwsaar.assetserver.core.AssetServer;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;

/**
 * Einstiegspunkt der Asset-Server CLI.
 *
 * <p>Baut den Kontext (stdout/stderr, Asset-Server-Fabrik) und die Picocli-Command-Struktur,
 * führt den Befehl aus und beendet den Prozess mit dessen Exit-Code.
 */
public final class AssetCliMain {

    private AssetCliMain() {}

    public static void main(String[] args) {
        System.exit(run(args,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8)));
    }

    /**
     * Führt die CLI ohne {@code System.exit} aus.
     *
     * @param args Kommandozeilenargumente
     * @param out  Ausgabe
     * @param err  Fehlerausgabe
     * @return Exit-Code
     */
    public static int run(String[] args, PrintWriter out, PrintWriter err) {
        CliContext ctx = new CliContext(out, err, AssetServer::forDirectory);
        CommandLine cmd = new CommandLine(AssetRootCommand.class, new ContextFactory(ctx));
        cmd.setOut(out);
        cmd.setErr(err);
        return cmd.execute(args);
    }
}
