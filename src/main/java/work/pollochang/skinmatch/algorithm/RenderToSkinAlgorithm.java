package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.converter.RenderToSkinConverter;
import work.pollochang.skinmatch.core.ImageHandle;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 先把渲染圖轉成皮膚貼圖 (已是 64×64 則不轉換)，
 * 再只比對渲染圖中看得到的格子 (正、上、左面) 的像素均方根差。
 */
public class RenderToSkinAlgorithm implements MatchingAlgorithm {

    public static final String NAME = "render_to_skin";

    private static final Map<String, Double> WEIGHTS = Weights.builder()
            .put("visible_regions", 1.0)
            .build();

    /**
     * @param visibleChannels 可見格子的 RGBA 通道值
     */
    public record Features(String algorithm, int[] visibleChannels) implements FeatureBundle {

        public Features {
            visibleChannels = visibleChannels.clone();
        }

        @Override
        public int[] visibleChannels() {
            return visibleChannels.clone();
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Render to Skin (Convert+Match)";
    }

    @Override
    public String description() {
        return "最適合 3D 渲染圖。先以區域偵測將渲染圖轉成 2D 皮膚，"
                + "再逐像素比對渲染圖中可見的區域 (正面、上面、左面)。比 Render Match 慢，但準確得多。";
    }

    @Override
    public Map<String, Double> weights() {
        return WEIGHTS;
    }

    @Override
    public FeatureBundle extract(ImageHandle image) {
        ImageHandle skin = RenderToSkinConverter.convert(image);
        return new Features(NAME, RenderToSkinConverter.visibleRegionChannels(skin));
    }

    @Override
    public Similarity score(FeatureBundle query, FeatureBundle candidate) {
        int[] a = features(query, Features.class).visibleChannels();
        int[] b = features(candidate, Features.class).visibleChannels();

        double pixelDistance;
        if (a.length != b.length || a.length == 0) {
            pixelDistance = 1.0;
        } else {
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                double diff = a[i] - b[i];
                sum += diff * diff;
            }
            pixelDistance = Math.sqrt(sum / a.length) / 255.0;
        }

        double combined = WEIGHTS.get("visible_regions") * pixelDistance;
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("pixel_dist", pixelDistance);
        metrics.put("combined", combined);
        return new Similarity(combined, metrics);
    }
}
