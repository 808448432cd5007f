package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.feature.ColorHistogram;
import work.pollochang.skinmatch.feature.DominantColorSet;
import work.pollochang.skinmatch.feature.DominantColors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 色彩分佈：直方圖 70%、主要色 30%。
 */
public class ColorDistributionAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "color_distribution";

    private static final int COLOR_COUNT = 12;

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("color_histogram", 0.70)
            .put("dominant_colors", 0.30)
            .build();

    public record Features(String algorithm, double[] histogram, DominantColorSet colors) implements FeatureBundle {

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
        return "Color Distribution";
    }

    @Override
    public String description() {
        return "以整體色彩分佈為主：色彩直方圖 (70%) 與主要色 (30%)。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        return new Features(NAME,
                ColorHistogram.compute(image, ColorHistogram.DEFAULT_BINS),
                DominantColors.extract(image, COLOR_COUNT, true));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Features q = features(query, Features.class);
        Features c = features(candidate, Features.class);

        double histDistance = ColorHistogram.distance(q.histogram(), c.histogram());
        double colorDistance = DominantColors.paletteDistance(q.colors(), c.colors());

        double combined = WEIGHTS.get("color_histogram") * histDistance
                + WEIGHTS.get("dominant_colors") * colorDistance;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("hist_dist", histDistance);
        metrics.put("color_dist", colorDistance);
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
