package work.pollochang.skinmatch.algorithm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 比對結果。
 * @param distance 加權後的綜合距離，越小越相似
 * @param metrics 未加權的各項距離，僅供診斷與顯示，不參與排序
 */
public record Similarity(double distance, Map<String, Double> metrics) {

    public Similarity {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }
}
