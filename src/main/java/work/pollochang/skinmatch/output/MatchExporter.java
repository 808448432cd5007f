package work.pollochang.skinmatch.output;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.skinmatch.search.MatchCandidate;
import work.pollochang.skinmatch.tools.FileTools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 將搜尋結果依名次複製到輸出目錄。
 */
@Slf4j
public class MatchExporter {

    private MatchExporter() {}

    /**
     * 產生檔名 match_{rank}_{原始檔名}.png，原始檔名已帶 .png 時不重複加上副檔名。
     */
    public static String outputName(int rank, Path source) {
        String name = source.getFileName().toString();
        String stem = name.toLowerCase().endsWith(".png") ? name.substring(0, name.length() - 4) : name;
        return "match_" + rank + "_" + stem + ".png";
    }

    /**
     * @param matches 依名次排序的結果
     * @param clearExisting 複製前是否先刪除目錄中既有的檔案
     * @return 成功複製的結果，複製失敗的項目會記錄後略過
     */
    public static List<ExportedMatch> export(List<MatchCandidate> matches, Path outputDir, boolean clearExisting) {
        FileTools.ensureDirectoryExists(outputDir);
        if (clearExisting) {
            clearDirectory(outputDir);
        }

        List<ExportedMatch> exported = new ArrayList<>(matches.size());
        long totalSize = 0;
        int rank = 0;
        for (MatchCandidate match : matches) {
            rank++;
            Path destination = outputDir.resolve(outputName(rank, match.path()));
            try {
                Files.copy(match.path(), destination,
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                log.debug("{} - 已複製為 {}", match.path(), destination.getFileName());
                totalSize += Files.size(destination);
                exported.add(new ExportedMatch(rank, match.path(), destination, match.distance(), match.metrics()));
            } catch (IOException e) {
                log.warn("{} - 複製失敗: {}", match.path(), e.getMessage());
            }
        }
        log.info("{} - 已輸出 {} 個結果，共 {}", outputDir, exported.size(), FileTools.formatFileSize(totalSize));
        return exported;
    }

    private static void clearDirectory(Path outputDir) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(outputDir)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    Files.delete(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("無法清除輸出目錄: " + outputDir, e);
        }
    }
}
