package work.pollochang.skinmatch.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.skinmatch.search.MatchCandidate;
import work.pollochang.skinmatch.search.SearchResult;
import work.pollochang.skinmatch.search.SearchStats;
import work.pollochang.skinmatch.search.SearchStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchReportWriterTest {

    @Test
    void testWriteAndRead(@TempDir Path tempDir) throws IOException {
        Path skinA = tempDir.resolve("a.png");
        Path skinB = tempDir.resolve("b.png");
        SearchResult result = new SearchResult(List.of(
                new MatchCandidate(0.1, skinA, Map.of("color_dist", 0.2, "combined", 0.1)),
                new MatchCandidate(0.4, skinB, Map.of("combined", 0.4))),
                SearchStatus.CANCELLED, new SearchStats(10, 4, 1));
        List<ExportedMatch> exported = List.of(
                new ExportedMatch(1, skinA, tempDir.resolve("out/match_1_a.png"), 0.1, Map.of()));

        SearchReportWriter writer = new SearchReportWriter();
        SearchReport report = writer.build(tempDir.resolve("query.png"), tempDir, "balanced", result, exported);
        Path json = tempDir.resolve("report.json");
        writer.write(json, report);

        String text = Files.readString(json);
        assertTrue(text.contains("\"status\" : \"CANCELLED\""));
        SearchReport loaded = writer.read(json);
        assertEquals(report, loaded);
        assertEquals(2, loaded.matches().size());
        assertEquals(tempDir.resolve("out/match_1_a.png").toString(), loaded.matches().get(0).copiedTo());
        assertNull(loaded.matches().get(1).copiedTo());
        assertEquals(2, loaded.matches().get(1).rank());
        assertEquals(4, loaded.processed());
    }
}
