package work.pollochang.skinmatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.core.ImageLoader;
import work.pollochang.skinmatch.output.SearchReport;
import work.pollochang.skinmatch.output.SearchReportWriter;

import java.awt.*;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    private int run(StringWriter out, String... args) {
        CommandLine commandLine = new CommandLine(new Execute());
        commandLine.setOut(new PrintWriter(out));
        return commandLine.execute(args);
    }

    @Test
    void testAlgorithmsCommand_ListsRegisteredAlgorithms() {
        StringWriter out = new StringWriter();

        int exitCode = run(out, "algorithms");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("balanced"));
        assertTrue(out.toString().contains("render_to_skin"));
        assertTrue(out.toString().contains("ai_perceptual"));
    }

    @Test
    void testNoSubcommand_PrintsUsage() {
        StringWriter out = new StringWriter();

        assertEquals(0, run(out));
        assertTrue(out.toString().contains("search"));
    }

    /**
     * 完整流程：搜尋、輸出檔案、寫出報告
     */
    @Test
    void testSearchCommand_EndToEnd(@TempDir Path tempDir) throws IOException {
        Path skins = Files.createDirectory(tempDir.resolve("skins"));
        TestImages.write(skins.resolve("red.png"), TestImages.solid(64, 64, Color.RED));
        TestImages.write(skins.resolve("blue.png"), TestImages.solid(64, 64, Color.BLUE));
        TestImages.write(skins.resolve("green.png"), TestImages.solid(64, 64, Color.GREEN));
        Path query = TestImages.write(tempDir.resolve("query.png"), TestImages.solid(64, 64, Color.RED));
        Path output = tempDir.resolve("output");
        Path report = tempDir.resolve("report.json");

        int exitCode = run(new StringWriter(), "search",
                "-q", query.toString(),
                "-d", skins.toString(),
                "-k", "2",
                "-o", output.toString(),
                "--report", report.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(output.resolve("match_1_red.png")));
        try (Stream<Path> files = Files.list(output)) {
            assertEquals(2, files.count());
        }
        SearchReport loaded = new SearchReportWriter().read(report);
        assertEquals("COMPLETED", loaded.status());
        assertEquals(3, loaded.processed());
        assertEquals(skins.resolve("red.png").toString(), loaded.matches().get(0).path());
    }

    @Test
    void testSearchCommand_UnknownAlgorithmExitsWithTwo(@TempDir Path tempDir) throws IOException {
        Path query = TestImages.write(tempDir.resolve("query.png"), TestImages.solid(8, 8, Color.RED));

        int exitCode = run(new StringWriter(), "search", "-q", query.toString(), "-d", tempDir.toString(),
                "-a", "nope", "-o", tempDir.resolve("out").toString());

        assertEquals(SearchBatch.EXIT_INVALID_INPUT, exitCode);
    }

    @Test
    void testSearchCommand_MissingQueryExitsWithTwo(@TempDir Path tempDir) {
        int exitCode = run(new StringWriter(), "search", "-q", tempDir.resolve("none.png").toString(),
                "-d", tempDir.toString(), "-o", tempDir.resolve("out").toString());

        assertEquals(SearchBatch.EXIT_INVALID_INPUT, exitCode);
    }

    @Test
    void testConvertCommand_WritesSkinTexture(@TempDir Path tempDir) throws IOException {
        Path render = TestImages.write(tempDir.resolve("render.png"), TestImages.solid(120, 240, Color.ORANGE));
        Path skin = tempDir.resolve("out/skin.png");

        int exitCode = run(new StringWriter(), "convert", "-i", render.toString(), "-o", skin.toString());

        assertEquals(0, exitCode);
        ImageHandle converted = ImageLoader.load(skin);
        assertEquals(64, converted.width());
        assertEquals(64, converted.height());
    }
}
