package work.pollochang.skinmatch.feature;

import work.pollochang.skinmatch.core.ImageHandle;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 未量化的精確顏色頻率表。
 */
public final class ColorFrequency {

    private ColorFrequency() {}

    /**
     * @return 顏色 (0xRRGGBB) → 出現比例，總和為 1.0
     */
    public static Map<Integer, Double> table(ImageHandle image) {
        Map<Integer, Integer> counts = new HashMap<>();
        int[] pixels = image.rgbPixels();
        for (int rgb : pixels) {
            counts.merge(rgb, 1, Integer::sum);
        }
        Map<Integer, Double> frequencies = new HashMap<>(counts.size() * 2);
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            frequencies.put(entry.getKey(), (double) entry.getValue() / pixels.length);
        }
        return Collections.unmodifiableMap(frequencies);
    }

    /**
     * 在兩張表的顏色聯集上加總頻率差的絕對值，除以 2 後截斷到 [0, 1]。
     */
    public static double distance(Map<Integer, Double> f1, Map<Integer, Double> f2) {
        Set<Integer> colors = new HashSet<>(f1.keySet());
        colors.addAll(f2.keySet());
        double total = 0;
        for (Integer color : colors) {
            total += Math.abs(f1.getOrDefault(color, 0.0) - f2.getOrDefault(color, 0.0));
        }
        return Math.max(0.0, Math.min(1.0, total / 2.0));
    }

    public static int overlap(Map<Integer, Double> f1, Map<Integer, Double> f2) {
        int overlap = 0;
        for (Integer color : f1.keySet()) {
            if (f2.containsKey(color)) {
                overlap++;
            }
        }
        return overlap;
    }
}
