package work.pollochang.skinmatch.algorithm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 依宣告順序保存的權重表，建立時檢查總和為 1.0。
 */
final class Weights {

    private static final double TOLERANCE = 1e-9;

    private final Map<String, Double> weights = new LinkedHashMap<>();

    private Weights() {}

    static Weights builder() {
        return new Weights();
    }

    Weights put(String component, double weight) {
        weights.put(component, weight);
        return this;
    }

    Map<String, Double> build() {
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalStateException("權重總和必須為 1.0，實際為 " + sum + ": " + weights);
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }
}
