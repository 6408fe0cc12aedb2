package de.htwsaar.assetserver.cli.command.root;

import de.htwsaar.assetserver.cli.command.asset.InfoCommand;
import de.htwsaar.assetserver.cli.command.asset.TagCommand;
import de.htwsaar.assetserver.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Ohne Subcommand wird nur die Usage ausgegeben.
 */
@Command(
        name = "assetserver",
        description = "Asset-Server CLI",
        mixinStandardHelpOptions = true,
        subcommands = {TagCommand.class, InfoCommand.class, HelpCommand.class})
public final class AssetRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext
     */
    public AssetRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `assetserver help <command>`.");
        ctx.out().flush();
    }
}
