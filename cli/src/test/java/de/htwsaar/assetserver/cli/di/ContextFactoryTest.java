package de.htwsaar.assetserver.cli.di;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import de.htwsaar.assetserver.cli.command.asset.TagCommand;
import de.htwsaar.assetserver.core.AssetServer;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ContextFactoryTest {

    @Test
    void shouldInjectContextIntoCommands() throws Exception {
        CliContext ctx = new CliContext(
                new PrintWriter(new StringWriter()), new PrintWriter(new StringWriter()), AssetServer::forDirectory);
        CommandLine.IFactory fallback = mock(CommandLine.IFactory.class);

        TagCommand command = new ContextFactory(ctx, fallback).create(TagCommand.class);

        assertNotNull(command);
        verifyNoInteractions(fallback);
    }

    @Test
    void shouldDelegateOtherClassesToFallback() throws Exception {
        CliContext ctx = new CliContext(
                new PrintWriter(new StringWriter()), new PrintWriter(new StringWriter()), AssetServer::forDirectory);
        CommandLine.IFactory fallback = mock(CommandLine.IFactory.class);
        when(fallback.create(StringBuilder.class)).thenReturn(new StringBuilder("x"));

        StringBuilder created = new ContextFactory(ctx, fallback).create(StringBuilder.class);

        assertEquals("x", created.toString());
    }

    @Test
    void serverForShouldUseFactory() {
        @SuppressWarnings("unchecked")
        Function<Path, AssetServer> factory = mock(Function.class);
        AssetServer server = AssetServer.forDirectory(Path.of("."));
        when(factory.apply(Path.of("x"))).thenReturn(server);
        CliContext ctx = new CliContext(new PrintWriter(new StringWriter()), new PrintWriter(new StringWriter()), factory);

        assertSame(server, ctx.serverFor(Path.of("x")));
    }
}
