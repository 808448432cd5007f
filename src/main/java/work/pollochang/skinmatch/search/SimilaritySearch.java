package work.pollochang.skinmatch.search;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.skinmatch.algorithm.AlgorithmRegistry;
import work.pollochang.skinmatch.algorithm.FeatureBundle;
import work.pollochang.skinmatch.algorithm.MatchingAlgorithm;
import work.pollochang.skinmatch.algorithm.Similarity;
import work.pollochang.skinmatch.core.ConfigurationException;
import work.pollochang.skinmatch.core.ImageLoader;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.core.ImageReadException;
import work.pollochang.skinmatch.tools.FileTools;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 以查詢圖片的特徵，在目錄樹中找出最相似的 K 個檔案。
 * <p>
 * 無法讀取的檔案會被跳過並計入統計，不會中斷搜尋。
 * 取消時回傳到目前為止的部分結果。
 */
@Slf4j
public class SimilaritySearch {

    private static final int BATCH_PER_THREAD = 4;

    private final AlgorithmRegistry registry;

    public SimilaritySearch(AlgorithmRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public FeatureBundle extractFeatures(ImageHandle image, String algorithm) {
        return registry.require(algorithm).extract(image);
    }

    public FeatureBundle extractFeatures(Path imagePath, String algorithm) throws ImageReadException {
        MatchingAlgorithm matchingAlgorithm = registry.require(algorithm);
        return matchingAlgorithm.extract(ImageLoader.load(imagePath));
    }

    /**
     * 比較兩組特徵，依特徵上標記的演算法分派。
     * @throws IllegalArgumentException 兩組特徵由不同演算法產生
     */
    public Similarity score(FeatureBundle first, FeatureBundle second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (!first.algorithm().equals(second.algorithm())) {
            throw new IllegalArgumentException("特徵由不同演算法產生: "
                    + first.algorithm() + " / " + second.algorithm());
        }
        MatchingAlgorithm algorithm = registry.find(first.algorithm())
                .orElseThrow(() -> new IllegalArgumentException("未註冊的演算法: " + first.algorithm()));
        return algorithm.score(first, second);
    }

    /**
     * 讀取查詢圖片後進行搜尋。
     * @throws ImageReadException 查詢圖片無法讀取
     */
    public SearchResult search(Path queryImage,
                               Path root,
                               SearchParams params,
                               Consumer<SearchProgress> onProgress,
                               BooleanSupplier shouldCancel) throws ImageReadException {
        MatchingAlgorithm algorithm = validate(root, params);
        Consumer<SearchProgress> progress = onProgress == null ? p -> { } : onProgress;
        progress.accept(new SearchProgress(0, 0, "擷取查詢圖片特徵: " + queryImage.getFileName()));
        FeatureBundle query = algorithm.extract(ImageLoader.load(queryImage));
        return search(query, root, params, progress, shouldCancel);
    }

    public SearchResult search(FeatureBundle query,
                               Path root,
                               int k,
                               String algorithm,
                               Consumer<SearchProgress> onProgress,
                               BooleanSupplier shouldCancel) {
        return search(query, root, SearchParams.of(k, algorithm), onProgress, shouldCancel);
    }

    /**
     * @param onProgress 進度回呼，可為 null
     * @param shouldCancel 取消判斷，可為 null
     * @throws ConfigurationException 參數錯誤或目錄不存在
     * @throws IllegalArgumentException 查詢特徵與指定演算法不符
     */
    public SearchResult search(FeatureBundle query,
                               Path root,
                               SearchParams params,
                               Consumer<SearchProgress> onProgress,
                               BooleanSupplier shouldCancel) {
        Objects.requireNonNull(query, "query");
        MatchingAlgorithm algorithm = validate(root, params);
        if (!algorithm.name().equals(query.algorithm())) {
            throw new IllegalArgumentException("查詢特徵由 " + query.algorithm()
                    + " 產生，無法用於 " + algorithm.name());
        }
        Consumer<SearchProgress> progress = onProgress == null ? p -> { } : onProgress;
        BooleanSupplier cancel = shouldCancel == null ? () -> false : shouldCancel;
        int interval = params.progressInterval() > 0 ? params.progressInterval() : algorithm.progressInterval();

        progress.accept(new SearchProgress(0, 0, "統計檔案數量..."));
        List<Path> files = new ArrayList<>();
        if (!collectFiles(root, files, cancel)) {
            log.info("{} - 統計檔案時已取消", root);
            progress.accept(new SearchProgress(0, 0, "搜尋已取消"));
            return new SearchResult(List.of(), SearchStatus.CANCELLED, new SearchStats(files.size(), 0, 0));
        }
        Collections.sort(files);
        progress.accept(new SearchProgress(0, files.size(), "找到 " + files.size() + " 個檔案"));
        log.info("{} - 共 {} 個候選檔案，演算法: {}，取前 {} 名", root, files.size(), algorithm.name(), params.topK());

        Aggregator aggregator = new Aggregator(params.topK(), files.size(), interval, progress);
        SearchStatus status = params.threads() > 1
                ? runParallel(files, algorithm, query, params.threads(), aggregator, cancel)
                : runSequential(files, algorithm, query, aggregator, cancel);

        if (status == SearchStatus.CANCELLED) {
            progress.accept(new SearchProgress(aggregator.examined, files.size(),
                    "搜尋已取消，保留目前 " + aggregator.topK.size() + " 筆結果"));
        }
        SearchStats stats = new SearchStats(files.size(), aggregator.processed, aggregator.skipped);
        log.info("{} - {}，已比對: {}，跳過: {}，總計: {}", root, status.getDescription(),
                stats.processed(), stats.skipped(), stats.total());
        return new SearchResult(aggregator.topK.toList(), status, stats);
    }

    private MatchingAlgorithm validate(Path root, SearchParams params) {
        Objects.requireNonNull(params, "params");
        if (params.topK() < 1) {
            throw new ConfigurationException("K 必須至少為 1: " + params.topK());
        }
        if (params.threads() < 1) {
            throw new ConfigurationException("執行緒數必須至少為 1: " + params.threads());
        }
        if (params.progressInterval() < 0) {
            throw new ConfigurationException("進度回報間隔不可為負數: " + params.progressInterval());
        }
        if (root == null || !Files.isDirectory(root)) {
            throw new ConfigurationException("搜尋目錄不存在: " + root);
        }
        return registry.require(params.algorithm());
    }

    /**
     * @return false 表示統計途中被取消
     */
    private boolean collectFiles(Path root, List<Path> files, BooleanSupplier cancel) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                            if (cancel.getAsBoolean()) {
                                cancelled.set(true);
                                return FileVisitResult.TERMINATE;
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile()) {
                                files.add(file);
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException exc) {
                            log.debug("{} - 無法存取，略過: {}", file, exc.toString());
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            throw new ConfigurationException("無法走訪搜尋目錄 " + root + ": " + e.getMessage());
        }
        return !cancelled.get();
    }

    private SearchStatus runSequential(List<Path> files,
                                       MatchingAlgorithm algorithm,
                                       FeatureBundle query,
                                       Aggregator aggregator,
                                       BooleanSupplier cancel) {
        for (Path file : files) {
            if (cancel.getAsBoolean()) {
                return SearchStatus.CANCELLED;
            }
            aggregator.accept(evaluate(file, algorithm, query));
        }
        return SearchStatus.COMPLETED;
    }

    /**
     * 以固定大小的批次送出工作，避免一次把整個目錄排進佇列。
     * 結果依檔案順序由呼叫端執行緒彙整，Top-K 只有單一寫入者。
     */
    private SearchStatus runParallel(List<Path> files,
                                     MatchingAlgorithm algorithm,
                                     FeatureBundle query,
                                     int threads,
                                     Aggregator aggregator,
                                     BooleanSupplier cancel) {
        log.debug("使用 {} 個執行緒進行比對", threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        int batchSize = threads * BATCH_PER_THREAD;
        try {
            for (int start = 0; start < files.size() && !cancelled.get(); start += batchSize) {
                if (cancel.getAsBoolean()) {
                    cancelled.set(true);
                    break;
                }
                List<Future<Evaluation>> batch = new ArrayList<>(batchSize);
                for (Path file : files.subList(start, Math.min(files.size(), start + batchSize))) {
                    batch.add(executor.submit(() -> cancelled.get()
                            ? Evaluation.notRun(file)
                            : evaluate(file, algorithm, query)));
                }
                for (Future<Evaluation> future : batch) {
                    if (!cancelled.get() && cancel.getAsBoolean()) {
                        cancelled.set(true);
                    }
                    Evaluation evaluation = await(future, cancelled);
                    if (evaluation != null) {
                        aggregator.accept(evaluation);
                    }
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return cancelled.get() ? SearchStatus.CANCELLED : SearchStatus.COMPLETED;
    }

    private Evaluation await(Future<Evaluation> future, AtomicBoolean cancelled) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            log.warn("比對執行緒被中斷，停止搜尋");
            return null;
        } catch (ExecutionException e) {
            // 讀取失敗與執行期例外已在 evaluate 中處理，這裡只會是 Error
            cancelled.set(true);
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("比對工作失敗", cause);
        }
    }

    private static Evaluation evaluate(Path file, MatchingAlgorithm algorithm, FeatureBundle query) {
        try {
            FeatureBundle candidate = algorithm.extract(ImageLoader.load(file));
            Similarity similarity = algorithm.score(query, candidate);
            double distance = Double.isNaN(similarity.distance()) ? 1.0 : similarity.distance();
            return Evaluation.matched(new MatchCandidate(distance, file, similarity.metrics()));
        } catch (ImageReadException e) {
            log.debug("{} - 跳過: {}", file, e.getReason().getDescription());
            return Evaluation.skipped(file);
        } catch (RuntimeException e) {
            log.debug("{} - 特徵擷取失敗，跳過: {}", file, e.toString());
            return Evaluation.skipped(file);
        }
    }

    private enum Outcome { MATCHED, SKIPPED, NOT_RUN }

    private record Evaluation(Outcome outcome, Path path, MatchCandidate candidate) {

        static Evaluation matched(MatchCandidate candidate) {
            return new Evaluation(Outcome.MATCHED, candidate.path(), candidate);
        }

        static Evaluation skipped(Path path) {
            return new Evaluation(Outcome.SKIPPED, path, null);
        }

        static Evaluation notRun(Path path) {
            return new Evaluation(Outcome.NOT_RUN, path, null);
        }
    }

    /**
     * 單一寫入者的彙整狀態，同時負責依間隔回報進度。
     */
    private static final class Aggregator {

        private final TopKList topK;
        private final int total;
        private final int interval;
        private final Consumer<SearchProgress> progress;
        private final long startNanos = System.nanoTime();

        private int examined;
        private int processed;
        private int skipped;

        Aggregator(int k, int total, int interval, Consumer<SearchProgress> progress) {
            this.topK = new TopKList(k);
            this.total = total;
            this.interval = interval;
            this.progress = progress;
        }

        void accept(Evaluation evaluation) {
            switch (evaluation.outcome()) {
                case MATCHED -> {
                    processed++;
                    topK.offer(evaluation.candidate());
                }
                case SKIPPED -> skipped++;
                case NOT_RUN -> {
                    return;
                }
            }
            examined++;
            if (examined % interval == 0 || examined == total) {
                progress.accept(new SearchProgress(examined, total, message()));
            }
        }

        private String message() {
            double elapsed = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            double rate = elapsed > 0 ? examined / elapsed : 0.0;
            if (examined >= total) {
                return String.format("已處理 %d/%d 個檔案，耗時 %s", examined, total, FileTools.formatDuration(elapsed));
            }
            String eta = rate > 0 ? FileTools.formatDuration((total - examined) / rate) : "未知";
            return String.format("已處理 %d/%d 個檔案 (%.1f 檔/秒)，預估剩餘 %s", examined, total, rate, eta);
        }
    }
}
