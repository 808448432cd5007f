package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.feature.ColorHistogram;
import work.pollochang.skinmatch.feature.DominantColorSet;
import work.pollochang.skinmatch.feature.DominantColors;
import work.pollochang.skinmatch.feature.ImageHash;
import work.pollochang.skinmatch.feature.ImageHashes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通用演算法 (預設)：主要色 60%、色彩直方圖 35%、平均雜湊 5%。
 */
public class BalancedAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "balanced";

    private static final int HASH_SIZE = 8;
    private static final int COLOR_COUNT = 12;

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("dominant_colors", 0.60)
            .put("color_histogram", 0.35)
            .put("perceptual_hash", 0.05)
            .build();

    public record Features(String algorithm, ImageHash hash, DominantColorSet colors, double[] histogram)
            implements FeatureBundle {

        public Features {
            histogram = histogram.clone();
        }

        @Override
        public double[] histogram() {
            return histogram.clone();
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Balanced (Default)";
    }

    @Override
    public String description() {
        return "適用大多數情況。結合主要色 (60%)、色彩直方圖 (35%) 與平均雜湊 (5%)，最佳的通用演算法。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        return new Features(NAME,
                ImageHashes.averageHash(image, HASH_SIZE),
                DominantColors.extract(image, COLOR_COUNT, true),
                ColorHistogram.compute(image, ColorHistogram.DEFAULT_BINS));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Features q = features(query, Features.class);
        Features c = features(candidate, Features.class);

        double hashDistance = q.hash().distanceTo(c.hash());
        double colorDistance = DominantColors.paletteDistance(q.colors(), c.colors());
        double histDistance = ColorHistogram.distance(q.histogram(), c.histogram());

        double combined = WEIGHTS.get("dominant_colors") * colorDistance
                + WEIGHTS.get("color_histogram") * histDistance
                + WEIGHTS.get("perceptual_hash") * hashDistance;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("hash_dist", hashDistance * q.hash().length());
        metrics.put("color_dist", colorDistance);
        metrics.put("hist_dist", histDistance);
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
