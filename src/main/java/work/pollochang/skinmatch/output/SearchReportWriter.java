package work.pollochang.skinmatch.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.skinmatch.search.MatchCandidate;
import work.pollochang.skinmatch.search.SearchResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class SearchReportWriter {

    private final ObjectMapper mapper;

    public SearchReportWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * 組出報告內容。
     * @param exported 已複製的結果，可為空；有對應來源時記錄輸出檔案
     */
    public SearchReport build(Path query, Path directory, String algorithm,
                              SearchResult result, List<ExportedMatch> exported) {
        Map<Path, Path> copies = new HashMap<>();
        for (ExportedMatch match : exported) {
            copies.put(match.source(), match.destination());
        }

        List<SearchReport.Entry> entries = new ArrayList<>(result.matches().size());
        int rank = 0;
        for (MatchCandidate match : result.matches()) {
            rank++;
            Path copy = copies.get(match.path());
            entries.add(new SearchReport.Entry(rank, match.distance(), match.path().toString(),
                    copy == null ? null : copy.toString(), match.metrics()));
        }
        return new SearchReport(query.toString(), directory.toString(), algorithm, result.status().name(),
                result.stats().total(), result.stats().processed(), result.stats().skipped(), entries);
    }

    public void write(Path path, SearchReport report) throws IOException {
        log.info("正在將搜尋報告儲存至 {} ...", path);
        mapper.writeValue(path.toFile(), report);
    }

    public SearchReport read(Path path) throws IOException {
        return mapper.readValue(path.toFile(), SearchReport.class);
    }
}
