package work.pollochang.skinmatch.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 只保留距離最小的 K 筆結果，內部隨時維持由小到大排序。
 * 距離相同時以路徑字串排序，重複執行時結果順序一致。
 * 非執行緒安全，只能由單一執行緒寫入。
 */
public final class TopKList {

    static final Comparator<MatchCandidate> ORDER = Comparator
            .comparingDouble(MatchCandidate::distance)
            .thenComparing(candidate -> candidate.path().toString());

    private final int capacity;
    private final List<MatchCandidate> entries;

    public TopKList(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity 必須至少為 1: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayList<>(Math.min(capacity, 1024) + 1);
    }

    /**
     * @return 候選是否被保留
     */
    public boolean offer(MatchCandidate candidate) {
        if (entries.size() == capacity) {
            if (ORDER.compare(candidate, worst()) >= 0) {
                return false;
            }
            entries.remove(entries.size() - 1);
        }
        int index = Collections.binarySearch(entries, candidate, ORDER);
        entries.add(index < 0 ? -index - 1 : index, candidate);
        return true;
    }

    public MatchCandidate worst() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return 目前結果的不可變快照
     */
    public List<MatchCandidate> toList() {
        return List.copyOf(entries);
    }
}
