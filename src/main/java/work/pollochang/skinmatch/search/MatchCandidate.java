package work.pollochang.skinmatch.search;

import java.nio.file.Path;
import java.util.Map;

/**
 * 單一候選檔案的比對結果。
 */
public record MatchCandidate(double distance, Path path, Map<String, Double> metrics) {}
