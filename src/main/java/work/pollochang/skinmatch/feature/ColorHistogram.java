package work.pollochang.skinmatch.feature;

import work.pollochang.skinmatch.core.ImageHandle;

/**
 * RGB 立方體直方圖。
 */
public final class ColorHistogram {

    public static final int DEFAULT_BINS = 24;

    private static final double EPSILON = 1e-10;

    private ColorHistogram() {}

    /**
     * 將 RGB 立方體切成 bins³ 個格子並統計像素，回傳正規化後的機率分佈。
     * 索引為 (r * bins + g) * bins + b。
     */
    public static double[] compute(ImageHandle image, int bins) {
        double[] histogram = new double[bins * bins * bins];
        int[] pixels = image.rgbPixels();
        for (int rgb : pixels) {
            int r = ((rgb >> 16) & 0xFF) * bins / 256;
            int g = ((rgb >> 8) & 0xFF) * bins / 256;
            int b = (rgb & 0xFF) * bins / 256;
            histogram[(r * bins + g) * bins + b]++;
        }
        double sum = pixels.length + EPSILON;
        for (int i = 0; i < histogram.length; i++) {
            histogram[i] /= sum;
        }
        return histogram;
    }

    /**
     * 對稱的卡方距離: Σ (h1-h2)² / (h1+h2+ε) / 2，範圍 [0, 1]。
     * 長度不一致時回傳 1.0。
     */
    public static double distance(double[] h1, double[] h2) {
        if (h1.length != h2.length) {
            return 1.0;
        }
        double sum = 0;
        for (int i = 0; i < h1.length; i++) {
            double diff = h1[i] - h2[i];
            if (diff != 0) {
                sum += diff * diff / (h1[i] + h2[i] + EPSILON);
            }
        }
        return Math.min(1.0, sum / 2);
    }
}
