package work.pollochang.skinmatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.skinmatch.algorithm.EmbeddingAlgorithm;
import work.pollochang.skinmatch.search.SearchParams;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SearchBatchTest {

    private SearchBatch batch(Path tempDir, String algorithm) throws IOException {
        Path skins = Files.createDirectories(tempDir.resolve("skins"));
        TestImages.write(skins.resolve("red.png"), TestImages.solid(64, 64, Color.RED));
        TestImages.write(skins.resolve("blue.png"), TestImages.solid(64, 64, Color.BLUE));
        Path query = TestImages.write(tempDir.resolve("query.png"), TestImages.solid(64, 64, Color.RED));

        SearchBatch searchBatch = new SearchBatch();
        searchBatch.setQueryPath(query);
        searchBatch.setSearchDir(skins);
        searchBatch.setOutputDir(tempDir.resolve("output"));
        searchBatch.setSearchParams(new SearchParams(5, algorithm, 1, 0));
        return searchBatch;
    }

    /**
     * 外部取消時回傳 3，輸出目錄仍會建立
     */
    @Test
    void testCancelledSearch_ExitsWithThree(@TempDir Path tempDir) throws IOException {
        SearchBatch searchBatch = batch(tempDir, "balanced");
        searchBatch.setCancelSignal(() -> true);

        assertEquals(SearchBatch.EXIT_CANCELLED, searchBatch.execute());
        assertTrue(Files.isDirectory(tempDir.resolve("output")));
    }

    /**
     * 模型檔不存在時，學習式演算法改用替代公式而不是失敗
     */
    @Test
    void testMissingEmbeddingModel_FallsBack(@TempDir Path tempDir) throws IOException {
        SearchBatch searchBatch = batch(tempDir, EmbeddingAlgorithm.NAME);
        searchBatch.setEmbeddingModel(tempDir.resolve("missing.onnx"));

        assertEquals(SearchBatch.EXIT_OK, searchBatch.execute());
        assertTrue(Files.exists(tempDir.resolve("output/match_1_red.png")));
    }
}
