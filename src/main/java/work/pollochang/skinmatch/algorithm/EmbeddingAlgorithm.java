package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.embedding.EmbeddingBackend;
import work.pollochang.skinmatch.feature.ColorHistogram;
import work.pollochang.skinmatch.feature.DominantColorSet;
import work.pollochang.skinmatch.feature.DominantColors;
import work.pollochang.skinmatch.feature.Embeddings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 學習式特徵：模型向量的餘弦距離 50%、主要色 35%、直方圖 15%。
 * <p>
 * 模型不可用 (或任一張圖片沒有向量) 時改用替代公式：主要色 60%、直方圖 40%，
 * 並在 metrics 中標記 {@value #FALLBACK_METRIC} = 1.0。
 */
public class EmbeddingAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "ai_perceptual";
    public static final String FALLBACK_METRIC = "embedding_unavailable";

    private static final int COLOR_COUNT = 12;

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("deep_features", 0.50)
            .put("dominant_colors", 0.35)
            .put("color_histogram", 0.15)
            .build();

    private static final Map<String, Double> FALLBACK_WEIGHTS = Weights.builder()
            .put("dominant_colors", 0.60)
            .put("color_histogram", 0.40)
            .build();

    private final EmbeddingBackend backend;
    private final boolean available;

    /**
     * @param embedding 模型向量，沒有時為 null
     */
    public record Features(String algorithm, float[] embedding, DominantColorSet colors, double[] histogram)
            implements FeatureBundle {

        public Features {
            embedding = embedding == null ? null : embedding.clone();
            histogram = histogram.clone();
        }

        /** 模型不可用或推論失敗時為 null */
        @Override
        public float[] embedding() {
            return embedding == null ? null : embedding.clone();
        }

        @Override
        public double[] histogram() {
            return histogram.clone();
        }
    }

    public EmbeddingAlgorithm(EmbeddingBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.available = backend.isAvailable();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return available ? "AI Perceptual" : "AI Perceptual (fallback)";
    }

    @Override
    public String description() {
        return "以影像模型的特徵向量比對 (50%)，主要色 (35%) 與直方圖 (15%) 作為輔助。"
                + "模型不可用時改用主要色 (60%) 與直方圖 (40%)，結果會標記為替代公式。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    public boolean isEmbeddingAvailable() {
        return available;
    }

    @Override
    public int progressInterval() {
        return 10;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        float[] embedding = available ? backend.embed(image).orElse(null) : null;
        return new Features(NAME,
                embedding,
                DominantColors.extract(image, COLOR_COUNT, true),
                ColorHistogram.compute(image, ColorHistogram.DEFAULT_BINS));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Features q = features(query, Features.class);
        Features c = features(candidate, Features.class);

        double colorDistance = DominantColors.paletteDistance(q.colors(), c.colors());
        double histDistance = ColorHistogram.distance(q.histogram(), c.histogram());

        Map<String, Double> metrics = new LinkedHashMap<>();
        double combined;
        if (q.embedding() != null && c.embedding() != null) {
            double embeddingDistance = Embeddings.cosineDistance(q.embedding(), c.embedding());
            combined = WEIGHTS.get("deep_features") * embeddingDistance
                    + WEIGHTS.get("dominant_colors") * colorDistance
                    + WEIGHTS.get("color_histogram") * histDistance;
            metrics.put("ai_dist", embeddingDistance);
        } else {
            combined = FALLBACK_WEIGHTS.get("dominant_colors") * colorDistance
                    + FALLBACK_WEIGHTS.get("color_histogram") * histDistance;
            metrics.put(FALLBACK_METRIC, 1.0);
        }
        metrics.put("color_dist", colorDistance);
        metrics.put("hist_dist", histDistance);
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
