package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.feature.ColorHistogram;
import work.pollochang.skinmatch.feature.DominantColorSet;
import work.pollochang.skinmatch.feature.DominantColors;
import work.pollochang.skinmatch.feature.TextureSignature;
import work.pollochang.skinmatch.feature.TextureStatistics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 針對皮膚貼圖調整：紋理 40%、主要色 35%、尺寸 15%、直方圖 10%。
 */
public class SkinOptimizedAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "skin_optimized";

    private static final int COLOR_COUNT = 12;
    private static final double DIMENSION_MISMATCH = 0.5;

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("texture_pattern", 0.40)
            .put("dominant_colors", 0.35)
            .put("dimension_match", 0.15)
            .put("color_histogram", 0.10)
            .build();

    public record Features(String algorithm, DominantColorSet colors, double[] histogram,
                           TextureSignature texture, int width, int height) implements FeatureBundle {

        public Features {
            histogram = histogram.clone();
        }

        @Override
        public double[] histogram() {
            return histogram.clone();
        }

        /** 64×64 或舊版 64×32 皮膚 */
        public boolean isSkinTexture() {
            return width == 64 && (height == 64 || height == 32);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Skin Optimized";
    }

    @Override
    public String description() {
        return "以紋理 (邊緣密度與對比, 40%)、主要色 (35%)、尺寸是否同為皮膚貼圖 (15%) 與直方圖 (10%) 比對。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        return new Features(NAME,
                DominantColors.extract(image, COLOR_COUNT, true),
                ColorHistogram.compute(image, ColorHistogram.DEFAULT_BINS),
                TextureStatistics.signature(image),
                image.width(),
                image.height());
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Features q = features(query, Features.class);
        Features c = features(candidate, Features.class);

        double textureDistance = Math.min(1.0,
                Math.abs(q.texture().edgeDensity() - c.texture().edgeDensity())
                        + Math.abs(q.texture().contrast() - c.texture().contrast()) / 255.0);
        double colorDistance = DominantColors.paletteDistance(q.colors(), c.colors());
        boolean sameShape = (q.isSkinTexture() && c.isSkinTexture())
                || (q.width() == c.width() && q.height() == c.height());
        double dimensionDistance = sameShape ? 0.0 : DIMENSION_MISMATCH;
        double histDistance = ColorHistogram.distance(q.histogram(), c.histogram());

        double combined = WEIGHTS.get("texture_pattern") * textureDistance
                + WEIGHTS.get("dominant_colors") * colorDistance
                + WEIGHTS.get("dimension_match") * dimensionDistance
                + WEIGHTS.get("color_histogram") * histDistance;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("texture_dist", textureDistance);
        metrics.put("block_var_dist", TextureStatistics.blockVarianceDistance(
                q.texture().blockVariances(), c.texture().blockVariances()));
        metrics.put("color_dist", colorDistance);
        metrics.put("dim_dist", dimensionDistance);
        metrics.put("hist_dist", histDistance);
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
