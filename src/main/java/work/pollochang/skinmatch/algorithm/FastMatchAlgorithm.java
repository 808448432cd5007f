package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.feature.ColorHistogram;
import work.pollochang.skinmatch.feature.ImageHash;
import work.pollochang.skinmatch.feature.ImageHashes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 最快速的比對：16 格直方圖 80%、平均雜湊 20%。
 */
public class FastMatchAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "fast";

    private static final int BINS = 16;
    private static final int HASH_SIZE = 8;

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("color_histogram", 0.80)
            .put("perceptual_hash", 0.20)
            .build();

    public record Features(String algorithm, double[] histogram, ImageHash hash) implements FeatureBundle {

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
        return "Fast Match";
    }

    @Override
    public String description() {
        return "速度優先：較粗的色彩直方圖 (80%) 與平均雜湊 (20%)，適合非常大的目錄。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        return new Features(NAME,
                ColorHistogram.compute(image, BINS),
                ImageHashes.averageHash(image, HASH_SIZE));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Features q = features(query, Features.class);
        Features c = features(candidate, Features.class);

        double histDistance = ColorHistogram.distance(q.histogram(), c.histogram());
        double hashDistance = q.hash().distanceTo(c.hash());

        double combined = WEIGHTS.get("color_histogram") * histDistance
                + WEIGHTS.get("perceptual_hash") * hashDistance;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("hist_dist", histDistance);
        metrics.put("hash_dist", hashDistance * q.hash().length());
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
