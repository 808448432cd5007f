package work.pollochang.skinmatch;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.skinmatch.algorithm.AlgorithmRegistry;
import work.pollochang.skinmatch.core.ConfigurationException;
import work.pollochang.skinmatch.core.ImageReadException;
import work.pollochang.skinmatch.embedding.EmbeddingBackend;
import work.pollochang.skinmatch.embedding.OnnxEmbeddingBackend;
import work.pollochang.skinmatch.output.ExportedMatch;
import work.pollochang.skinmatch.output.MatchExporter;
import work.pollochang.skinmatch.output.SearchReportWriter;
import work.pollochang.skinmatch.search.MatchCandidate;
import work.pollochang.skinmatch.search.SearchParams;
import work.pollochang.skinmatch.search.SearchResult;
import work.pollochang.skinmatch.search.SimilaritySearch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 執行一次完整的搜尋：比對、輸出結果、寫出報告。
 */
@Setter
@Slf4j
public class SearchBatch {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_INPUT = 2;
    public static final int EXIT_CANCELLED = 3;

    private Path queryPath;
    private Path searchDir;
    private Path outputDir;
    private boolean clearOutput = true;
    private SearchParams searchParams;
    private long timeOutMin;
    private Path embeddingModel;
    private Path reportPath;
    private BooleanSupplier cancelSignal = () -> false;

    public int execute() {
        BooleanSupplier shouldCancel = cancelPredicate();

        try (EmbeddingBackend backend = OnnxEmbeddingBackend.open(embeddingModel)) {
            AlgorithmRegistry registry = AlgorithmRegistry.createDefault(backend);
            SimilaritySearch search = new SimilaritySearch(registry);

            SearchResult result = search.search(queryPath, searchDir, searchParams,
                    progress -> log.info(progress.message()), shouldCancel);

            if (result.isCancelled()) {
                log.warn("搜尋未完成，以下為取消前的部分結果。");
            }
            logMatches(result.matches());

            List<ExportedMatch> exported = MatchExporter.export(result.matches(), outputDir, clearOutput);
            if (reportPath != null) {
                SearchReportWriter writer = new SearchReportWriter();
                writer.write(reportPath, writer.build(queryPath, searchDir, searchParams.algorithm(), result, exported));
            }

            log.info("處理結果 -> 總計: {}, 已比對: {}, 跳過: {}",
                    result.stats().total(), result.stats().processed(), result.stats().skipped());
            return result.isCancelled() ? EXIT_CANCELLED : EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("參數錯誤: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (ImageReadException e) {
            log.error("{} - 無法讀取查詢圖片: {}", e.getPath(), e.getReason().getDescription());
            return EXIT_INVALID_INPUT;
        } catch (IOException | UncheckedIOException e) {
            log.error("寫出搜尋結果時發生錯誤。", e);
            return EXIT_INVALID_INPUT;
        }
    }

    /**
     * 外部取消訊號與逾時任一成立即取消。
     */
    private BooleanSupplier cancelPredicate() {
        if (timeOutMin <= 0) {
            return cancelSignal;
        }
        long deadline = System.nanoTime() + TimeUnit.MINUTES.toNanos(timeOutMin);
        return () -> {
            if (System.nanoTime() - deadline >= 0) {
                return true;
            }
            return cancelSignal.getAsBoolean();
        };
    }

    private void logMatches(List<MatchCandidate> matches) {
        log.info("========================================搜尋結果========================================");
        int rank = 0;
        for (MatchCandidate match : matches) {
            rank++;
            log.info(" {}. {} (距離: {})", rank, match.path(), String.format("%.4f", match.distance()));
            log.debug("    {}", match.metrics());
        }
        log.info("========================================搜尋結果========================================");
    }
}
