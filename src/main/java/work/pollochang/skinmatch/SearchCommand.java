package work.pollochang.skinmatch;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import work.pollochang.skinmatch.search.SearchParams;

import java.io.File;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "search",
        mixinStandardHelpOptions = true,
        description = "在目錄中搜尋與查詢圖片最相似的皮膚。")
public class SearchCommand implements Callable<Integer> {

    @Mixin
    private LoggingOptions loggingOptions;

    @Option(names = {"-q", "--query"}, required = true, description = "查詢圖片 (皮膚貼圖或角色渲染圖)。")
    private File query;

    @Option(names = {"-d", "--dir"}, required = true, description = "要搜尋的目錄，會遞迴搜尋子目錄。")
    private File searchDir;

    @Option(names = {"-k", "--top"}, defaultValue = "5", description = "保留的結果數量 (預設: 5)。")
    private int topK;

    @Option(names = {"-a", "--algorithm"}, defaultValue = "balanced", description = "比對演算法，可用 algorithms 子命令查詢 (預設: balanced)。")
    private String algorithm;

    @Option(names = {"-o", "--output"}, defaultValue = "output", description = "結果輸出目錄 (預設: output)。")
    private File outputDir;

    @Option(names = {"--no-clear"}, description = "輸出前不清除輸出目錄中既有的檔案。")
    private boolean keepExisting;

    @Option(names = {"-t", "--threads"}, defaultValue = "1", description = "處理候選檔案的執行緒數 (預設: 1)。")
    private int threads;

    @Option(names = {"--progress-interval"}, defaultValue = "0", description = "每處理幾個檔案回報一次進度，0 表示依演算法決定 (預設: 100，ai_perceptual 為 10)。")
    private int progressInterval;

    @Option(names = {"--timeOut"}, defaultValue = "0", description = "搜尋逾時(分鐘)，逾時後保留目前結果並結束，0 表示不限制 (預設: 0)。")
    private long timeOutMin;

    @Option(names = {"--embedding-model"}, description = "ONNX 圖片特徵模型，供 ai_perceptual 演算法使用。")
    private File embeddingModel;

    @Option(names = {"--report"}, description = "將搜尋結果另存為 JSON 報告。")
    private File report;

    @Override
    public Integer call() {
        log.info("========================================搜尋參數設定========================================");
        log.info("查詢圖片: {}", query.getAbsolutePath());
        log.info("搜尋目錄: {}", searchDir.getAbsolutePath());
        log.info("比對演算法: {}", algorithm);
        log.info("保留結果數: {}", topK);
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("執行緒數: {}", threads);
        log.info("逾時設定: {}", timeOutMin > 0 ? timeOutMin + " 分鐘" : "不限制");
        if (embeddingModel != null) {
            log.info("特徵模型: {}", embeddingModel.getAbsolutePath());
        }
        log.info("========================================搜尋參數設定========================================");

        SearchBatch searchBatch = new SearchBatch();
        searchBatch.setQueryPath(query.toPath());
        searchBatch.setSearchDir(searchDir.toPath());
        searchBatch.setOutputDir(outputDir.toPath());
        searchBatch.setClearOutput(!keepExisting);
        searchBatch.setSearchParams(new SearchParams(topK, algorithm, threads, progressInterval));
        searchBatch.setTimeOutMin(timeOutMin);
        searchBatch.setEmbeddingModel(embeddingModel == null ? null : embeddingModel.toPath());
        searchBatch.setReportPath(report == null ? null : report.toPath());
        return searchBatch.execute();
    }
}
