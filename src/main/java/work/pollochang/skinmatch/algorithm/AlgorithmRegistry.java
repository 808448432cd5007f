package work.pollochang.skinmatch.algorithm;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.skinmatch.core.ConfigurationException;
import work.pollochang.skinmatch.embedding.EmbeddingBackend;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 演算法註冊表。
 * 在程式啟動時建立一次，之後唯讀，可在多執行緒間直接共用。
 */
@Slf4j
public final class AlgorithmRegistry {

    private final Map<String, MatchingAlgorithm> algorithms;

    private AlgorithmRegistry(Map<String, MatchingAlgorithm> algorithms) {
        this.algorithms = Collections.unmodifiableMap(new LinkedHashMap<>(algorithms));
    }

    /**
     * 內建的所有演算法。
     * @param embeddingBackend 學習式特徵演算法使用的模型，不可用時該演算法使用替代公式
     */
    public static AlgorithmRegistry createDefault(EmbeddingBackend embeddingBackend) {
        return builder()
                .register(new RenderToSkinAlgorithm())
                .register(new RenderMatchAlgorithm())
                .register(new BalancedAlgorithm())
                .register(new ColorFrequencyAlgorithm())
                .register(new SkinOptimizedAlgorithm())
                .register(new DeepFeaturesAlgorithm())
                .register(new ColorDistributionAlgorithm())
                .register(new FastMatchAlgorithm())
                .register(new EmbeddingAlgorithm(embeddingBackend))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MatchingAlgorithm> find(String name) {
        return Optional.ofNullable(algorithms.get(name));
    }

    /**
     * @throws ConfigurationException 找不到指定名稱的演算法
     */
    public MatchingAlgorithm require(String name) {
        MatchingAlgorithm algorithm = algorithms.get(name);
        if (algorithm == null) {
            throw new ConfigurationException("未知的演算法: " + name + " (可用: " + algorithms.keySet() + ")");
        }
        return algorithm;
    }

    public Collection<MatchingAlgorithm> all() {
        return algorithms.values();
    }

    /**
     * @return 顯示名稱 → 內部名稱
     */
    public Map<String, String> displayNames() {
        Map<String, String> names = new LinkedHashMap<>();
        algorithms.forEach((name, algorithm) -> names.put(algorithm.displayName(), name));
        return Collections.unmodifiableMap(names);
    }

    public static final class Builder {

        private final Map<String, MatchingAlgorithm> algorithms = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(MatchingAlgorithm algorithm) {
            Objects.requireNonNull(algorithm, "algorithm must not be null");
            if (algorithms.putIfAbsent(algorithm.name(), algorithm) != null) {
                throw new IllegalStateException("演算法名稱重複: " + algorithm.name());
            }
            return this;
        }

        public AlgorithmRegistry build() {
            log.debug("已註冊 {} 個演算法: {}", algorithms.size(), algorithms.keySet());
            return new AlgorithmRegistry(algorithms);
        }
    }
}
