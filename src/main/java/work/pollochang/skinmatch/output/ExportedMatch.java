package work.pollochang.skinmatch.output;

import java.nio.file.Path;
import java.util.Map;

/**
 * 已複製到輸出目錄的結果。
 * @param rank 名次，1 為最相似
 * @param source 原始檔案
 * @param destination 輸出檔案 match_{rank}_{name}.png
 */
public record ExportedMatch(int rank, Path source, Path destination, double distance, Map<String, Double> metrics) {}
