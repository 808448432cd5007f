package work.pollochang.skinmatch.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.skinmatch.TestImages;
import work.pollochang.skinmatch.search.MatchCandidate;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MatchExporterTest {

    @Test
    void testOutputName() {
        assertEquals("match_1_steve.png", MatchExporter.outputName(1, Path.of("skins/steve.png")));
        assertEquals("match_3_alex.jpg.png", MatchExporter.outputName(3, Path.of("alex.jpg")));
    }

    /**
     * 依名次複製，並在複製前清除舊結果
     */
    @Test
    void testExport_ShouldCopyByRankAndClearOldResults(@TempDir Path tempDir) throws IOException {
        Path first = TestImages.write(tempDir.resolve("first.png"), TestImages.solid(8, 8, Color.RED));
        Path second = TestImages.write(tempDir.resolve("second.png"), TestImages.solid(8, 8, Color.BLUE));
        Path output = tempDir.resolve("output");
        Files.createDirectories(output);
        Files.writeString(output.resolve("match_1_old.png"), "stale");

        List<ExportedMatch> exported = MatchExporter.export(List.of(
                new MatchCandidate(0.0, first, Map.of("combined", 0.0)),
                new MatchCandidate(0.7, second, Map.of("combined", 0.7))), output, true);

        assertEquals(2, exported.size());
        assertEquals(output.resolve("match_1_first.png"), exported.get(0).destination());
        assertEquals(output.resolve("match_2_second.png"), exported.get(1).destination());
        assertEquals(2, exported.get(1).rank());
        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(exported.get(0).destination()));
        assertFalse(Files.exists(output.resolve("match_1_old.png")));
    }

    @Test
    void testExport_KeepExistingFilesWhenNotClearing(@TempDir Path tempDir) throws IOException {
        Path first = TestImages.write(tempDir.resolve("first.png"), TestImages.solid(8, 8, Color.RED));
        Path output = Files.createDirectories(tempDir.resolve("output"));
        Files.writeString(output.resolve("keep.txt"), "keep");

        MatchExporter.export(List.of(new MatchCandidate(0.1, first, Map.of())), output, false);

        assertTrue(Files.exists(output.resolve("keep.txt")));
        assertTrue(Files.exists(output.resolve("match_1_first.png")));
    }

    /**
     * 來源檔案消失時略過該筆，其他結果照常輸出
     */
    @Test
    void testExport_MissingSourceIsSkipped(@TempDir Path tempDir) throws IOException {
        Path first = TestImages.write(tempDir.resolve("first.png"), TestImages.solid(8, 8, Color.RED));
        Path output = tempDir.resolve("created/output");

        List<ExportedMatch> exported = MatchExporter.export(List.of(
                new MatchCandidate(0.1, tempDir.resolve("gone.png"), Map.of()),
                new MatchCandidate(0.2, first, Map.of())), output, true);

        assertEquals(1, exported.size());
        assertEquals(2, exported.get(0).rank());
        assertTrue(Files.exists(output.resolve("match_2_first.png")));
    }
}
