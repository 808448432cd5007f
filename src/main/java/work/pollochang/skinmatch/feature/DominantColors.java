package work.pollochang.skinmatch.feature;

import work.pollochang.skinmatch.core.ImageHandle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 主要色擷取與色盤距離。
 */
public final class DominantColors {

    /** 每個通道量化到 16 的倍數 */
    public static final int QUANT_MASK = 0xF0;
    /** 透明度低於此值的像素不列入統計 */
    public static final int VISIBILITY_THRESHOLD = 128;

    private static final double MAX_RGB_DISTANCE = 255.0 * Math.sqrt(3);

    private DominantColors() {}

    /**
     * 擷取出現頻率最高的 n 個量化顏色。
     * 頻率相同時以量化後的顏色值由小到大排序，確保結果穩定。
     * @param image 圖片
     * @param n 最多回傳的顏色數
     * @param respectAlpha 為 true 時排除透明度低於 {@link #VISIBILITY_THRESHOLD} 的像素
     */
    public static DominantColorSet extract(ImageHandle image, int n, boolean respectAlpha) {
        if (n <= 0) {
            return DominantColorSet.empty();
        }
        boolean skipTransparent = respectAlpha && image.hasAlpha();

        // 量化後每通道 16 階，共 4096 種組合
        int[] counts = new int[16 * 16 * 16];
        int[] pixels = image.argbPixels();
        for (int argb : pixels) {
            if (skipTransparent && (argb >>> 24) < VISIBILITY_THRESHOLD) {
                continue;
            }
            counts[bucketOf(argb)]++;
        }

        List<Integer> buckets = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0) {
                buckets.add(i);
            }
        }
        buckets.sort(Comparator.<Integer>comparingInt(i -> counts[i]).reversed()
                .thenComparingInt(i -> i));

        int size = Math.min(n, buckets.size());
        if (size == 0) {
            return DominantColorSet.empty();
        }
        int[] colors = new int[size];
        double[] weights = new double[size];
        long total = 0;
        for (int i = 0; i < size; i++) {
            int bucket = buckets.get(i);
            colors[i] = colorOf(bucket);
            total += counts[bucket];
        }
        for (int i = 0; i < size; i++) {
            weights[i] = (double) counts[buckets.get(i)] / total;
        }
        return new DominantColorSet(colors, weights);
    }

    /**
     * 色盤距離 (有方向性: query → candidate)。
     * 對 query 的每個顏色找出 candidate 中最近的顏色，以 query 權重加總後除以 255·√3。
     * 兩方皆為空時視為相同 (0.0)，只有一方為空時回傳最差距離 1.0。
     */
    public static double paletteDistance(DominantColorSet query, DominantColorSet candidate) {
        if (query.isEmpty() && candidate.isEmpty()) {
            return 0.0;
        }
        if (query.isEmpty() || candidate.isEmpty()) {
            return 1.0;
        }
        int[] queryColors = query.colors();
        double[] queryWeights = query.weights();
        int[] candidateColors = candidate.colors();
        double total = 0;
        for (int i = 0; i < queryColors.length; i++) {
            double min = Double.MAX_VALUE;
            for (int c : candidateColors) {
                min = Math.min(min, rgbDistance(queryColors[i], c));
            }
            total += queryWeights[i] * min;
        }
        return Math.min(1.0, total / MAX_RGB_DISTANCE);
    }

    static double rgbDistance(int c1, int c2) {
        int dr = ((c1 >> 16) & 0xFF) - ((c2 >> 16) & 0xFF);
        int dg = ((c1 >> 8) & 0xFF) - ((c2 >> 8) & 0xFF);
        int db = (c1 & 0xFF) - (c2 & 0xFF);
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    private static int bucketOf(int argb) {
        int r = ((argb >> 16) & QUANT_MASK) >> 4;
        int g = ((argb >> 8) & QUANT_MASK) >> 4;
        int b = (argb & QUANT_MASK) >> 4;
        return (r << 8) | (g << 4) | b;
    }

    private static int colorOf(int bucket) {
        int r = ((bucket >> 8) & 0xF) << 4;
        int g = ((bucket >> 4) & 0xF) << 4;
        int b = (bucket & 0xF) << 4;
        return (r << 16) | (g << 8) | b;
    }
}
