package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.feature.DominantColorSet;
import work.pollochang.skinmatch.feature.DominantColors;
import work.pollochang.skinmatch.feature.StructuralSimilarity;
import work.pollochang.skinmatch.feature.TextureStatistics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 結構導向：邊緣密度 50%、SSIM 30%、主要色 20%。
 */
public class DeepFeaturesAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "deep_features";

    private static final int COLOR_COUNT = 12;

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("edge_similarity", 0.50)
            .put("ssim", 0.30)
            .put("dominant_colors", 0.20)
            .build();

    /**
     * @param structure 供 SSIM 使用的固定尺寸灰階像素
     */
    public record Features(String algorithm, double edgeDensity, double[] structure, DominantColorSet colors)
            implements FeatureBundle {

        public Features {
            structure = structure.clone();
        }

        @Override
        public double[] structure() {
            return structure.clone();
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Deep Features";
    }

    @Override
    public String description() {
        return "著重形狀與結構：邊緣密度 (50%)、結構相似度 SSIM (30%)、主要色 (20%)。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        return new Features(NAME,
                TextureStatistics.edgeDensity(image),
                StructuralSimilarity.prepare(image),
                DominantColors.extract(image, COLOR_COUNT, true));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Features q = features(query, Features.class);
        Features c = features(candidate, Features.class);

        double edgeDistance = Math.abs(q.edgeDensity() - c.edgeDensity());
        double ssimDistance = StructuralSimilarity.distance(q.structure(), c.structure());
        double colorDistance = DominantColors.paletteDistance(q.colors(), c.colors());

        double combined = WEIGHTS.get("edge_similarity") * edgeDistance
                + WEIGHTS.get("ssim") * ssimDistance
                + WEIGHTS.get("dominant_colors") * colorDistance;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("edge_dist", edgeDistance);
        metrics.put("ssim_dist", ssimDistance);
        metrics.put("color_dist", colorDistance);
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
