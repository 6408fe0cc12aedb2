package de.htwsaar.assetserver.cli.app;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssetCliMainTest {

    @TempDir
    Path root;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("d/sub"));
        Files.writeString(root.resolve("a.js"), "ajs\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("b.min.js"), "b\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("d/style.css"), "style\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("d/sub/noext"), "<!doctype html>\n", StandardCharsets.UTF_8);
        Files.setLastModifiedTime(root.resolve("d/style.css"), FileTime.from(Instant.parse("2026-01-01T00:00:00Z")));
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void tagShouldPrintOneTaggedPathPerArgument() {
        int rc = run("tag", "--root", root.toString(), "a.js", "/d/style.css", "b.min.js", "d/sub/noext");

        assertEquals(0, rc, err.toString());
        assertEquals(
                String.join(System.lineSeparator(),
                        "a.sI22qapGJ0.js", "/d/style.EI7Zfw9kFp.css", "b.5OlMiKFkIc.min.js", "d/sub/noext.Erz6e6ZJsp")
                        + System.lineSeparator(),
                out.toString());
    }

    @Test
    void tagJsonShouldPrintJsonLines() throws Exception {
        int rc = run("tag", "--root", root.toString(), "--json", "d/style.css");

        assertEquals(0, rc);
        JsonNode line = new ObjectMapper().readTree(out.toString().trim());
        assertEquals("d/style.css", line.path("path").asText());
        assertEquals("d/style.EI7Zfw9kFp.css", line.path("taggedPath").asText());
        assertEquals("EI7Zfw9kFp", line.path("tag").asText());
        assertEquals(6, line.path("size").asLong());
        assertEquals("2026-01-01T00:00:00Z", line.path("modTime").asText());
    }

    @Test
    void infoShouldPrintMetadata() {
        int rc = run("info", "-r", root.toString(), "d/sub/noext");

        assertEquals(0, rc);
        String text = out.toString();
        assertTrue(text.contains("tag         : Erz6e6ZJsp"), text);
        assertTrue(text.contains("size        : 16"), text);
        assertTrue(text.contains("contentType : text/html;charset=UTF-8"), text);
    }

    @Test
    void missingPathShouldExitWithNotFoundAndContinue() {
        int rc = run("tag", "--root", root.toString(), "missing.js", "a.js");

        assertEquals(4, rc);
        assertTrue(out.toString().contains("a.sI22qapGJ0.js"));
        assertTrue(err.toString().contains("missing.js: not found"));
    }

    @Test
    void directoryAndTraversalShouldBeNotFound() {
        assertEquals(4, run("info", "--root", root.toString(), "d"));
        assertEquals(4, run("info", "--root", root.toString(), "../a.js"));
    }

    @Test
    void rootMustBeDirectory() {
        int rc = run("tag", "--root", root.resolve("a.js").toString(), "a.js");

        assertEquals(3, rc);
        assertTrue(err.toString().contains("Root is not a directory"));
    }

    @Test
    void missingRequiredOptionShouldBeUsageError() {
        assertEquals(2, run("tag", "a.js"));
    }

    @Test
    void noSubcommandShouldPrintUsage() {
        assertEquals(0, run());
        assertTrue(out.toString().contains("assetserver"));
    }

    private int run(String... args) {
        return AssetCliMain.run(args, new PrintWriter(out, true), new PrintWriter(err, true));
    }
}
