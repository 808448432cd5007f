package work.pollochang.skinmatch.search;

import java.util.List;

/**
 * @param matches 依距離由小到大排序，最多 K 筆
 */
public record SearchResult(List<MatchCandidate> matches, SearchStatus status, SearchStats stats) {

    public SearchResult {
        matches = List.copyOf(matches);
    }

    public boolean isCancelled() {
        return status == SearchStatus.CANCELLED;
    }
}
