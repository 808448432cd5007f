package work.pollochang.skinmatch.output;

import java.util.List;
import java.util.Map;

/**
 * 搜尋報告，序列化為 JSON。路徑以字串保存。
 */
public record SearchReport(String query,
                           String directory,
                           String algorithm,
                           String status,
                           int total,
                           int processed,
                           int skipped,
                           List<Entry> matches) {

    public record Entry(int rank, double distance, String path, String copiedTo, Map<String, Double> metrics) {}
}
