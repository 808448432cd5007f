package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.feature.ColorFrequency;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 只看精確顏色值與其出現頻率，與版面配置無關。
 */
public class ColorFrequencyAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "color_frequency";

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("color_frequency", 1.0)
            .build();

    public record Features(String algorithm, Map<Integer, Double> frequencies) implements FeatureBundle {

        public Features {
            frequencies = Map.copyOf(frequencies);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Color Frequency";
    }

    @Override
    public String description() {
        return "依精確顏色值及其出現頻率比對，適合找出色盤相近但配置不同的皮膚。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        return new Features(NAME, ColorFrequency.table(image));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Map<Integer, Double> f1 = features(query, Features.class).frequencies();
        Map<Integer, Double> f2 = features(candidate, Features.class).frequencies();

        double distance = ColorFrequency.distance(f1, f2);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("color_freq_distance", distance);
        metrics.put("unique_colors_1", (double) f1.size());
        metrics.put("unique_colors_2", (double) f2.size());
        metrics.put("color_overlap", (double) ColorFrequency.overlap(f1, f2));
        return new Similarity(distance, metrics);
    }
}
