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
 * Erzeugt getaggte Pfade, z. B. für Build-Skripte und Templates.
 */
@Command(
        name = "tag",
        description = "Print the tagged path for each asset",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  assetserver tag --root ./assets d/style.css app.min.js",
            "  assetserver tag --root ./assets /d/style.css --json"
        })
public final class TagCommand extends AbstractAssetCommand {

    public TagCommand(CliContext ctx) {
        super(ctx);
    }

    @Override
    protected void handle(AssetServer server, String path, PrintWriter out) {
        if (!printJson) {
            out.println(server.tag(path));
            return;
        }
        FileInfo info = server.info(path);
        String tagged = TagCodec.insertTag(path, info.tag());
        out.println(JacksonCodec.toJson(
                new AssetInfoLine(path, tagged, info.tag(), info.size(), info.contentType(), info.modTime())));
    }
}
