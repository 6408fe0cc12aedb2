package de.htwsaar.assetserver.cli.command.asset;

import de.htwsaar.assetserver.cli.di.CliContext;
import de.htwsaar.assetserver.cli.dto.AssetInfoLine;
import de.htwsaar.assetserver.common.serialization.JacksonCodec;
import de.htwsaar.assetserver.core.AssetServer;
import de.htwsaar.assetserver.core.domain.FileInfo;
import de.htwsaar.assetserver.core.tag.TagCodec;
import java.io.PrintWriter;
import picocli.CommandLine.Command;

/**
 * Zeigt die Metadaten, die der Server für ein Asset verwenden würde.
 */
@Command(
        name = "info",
        description = "Print tag, size, content type and modification time for each asset",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  assetserver info --root ./assets d/style.css",
            "  assetserver info --root ./assets d/style.css --json"
        })
public final class InfoCommand extends AbstractAssetCommand {

    public InfoCommand(CliContext ctx) {
        super(ctx);
    }

    @Override
    protected void handle(AssetServer server, String path, PrintWriter out) {
        FileInfo info = server.info(path);
        String tagged = TagCodec.insertTag(path, info.tag());
        if (printJson) {
            out.println(JacksonCodec.toJson(
                    new AssetInfoLine(path, tagged, info.tag(), info.size(), info.contentType(), info.modTime())));
            return;
        }
        out.println("[ASSET] " + path);
        out.printf("  tagged      : %s%n", tagged);
        out.printf("  tag         : %s%n", info.tag());
        out.printf("  size        : %d%n", info.size());
        out.printf("  contentType : %s%n", info.contentType() != null ? info.contentType() : "n/a");
        out.printf("  modTime     : %s%n", info.modTime());
    }
}
