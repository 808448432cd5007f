package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.feature.DominantColorSet;
import work.pollochang.skinmatch.feature.DominantColors;
import work.pollochang.skinmatch.feature.SpatialGrid;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 快速的渲染圖比對：24 色色盤 (70%) 加上 4×4 格平均色的空間分佈 (30%)。
 * 色盤擷取不排除透明像素。
 */
public class RenderMatchAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "render_match";

    private static final int COLOR_COUNT = 24;

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("color_palette", 0.70)
            .put("spatial_pattern", 0.30)
            .build();

    public record Features(String algorithm, DominantColorSet colors, double[] spatial) implements FeatureBundle {

        public Features {
            spatial = spatial.clone();
        }

        @Override
        public double[] spatial() {
            return spatial.clone();
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Render Match (3D→2D)";
    }

    @Override
    public String description() {
        return "專為 3D 渲染角色對 2D 皮膚設計。擷取 24 個主要色並分析 4x4 格的空間色彩分佈，"
                + "色盤比對 (70%) + 空間分佈 (30%)，不使用神經網路，速度快。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        return new Features(NAME,
                DominantColors.extract(image, COLOR_COUNT, false),
                SpatialGrid.averageColors(image, SpatialGrid.DEFAULT_GRID));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        Features q = features(query, Features.class);
        Features c = features(candidate, Features.class);

        double paletteDistance = DominantColors.paletteDistance(q.colors(), c.colors());
        double spatialDistance = SpatialGrid.distance(q.spatial(), c.spatial());

        double combined = WEIGHTS.get("color_palette") * paletteDistance
                + WEIGHTS.get("spatial_pattern") * spatialDistance;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("palette_dist", paletteDistance);
        metrics.put("spatial_dist", spatialDistance);
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
