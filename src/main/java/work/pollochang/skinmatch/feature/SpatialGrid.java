package work.pollochang.skinmatch.feature;

import work.pollochang.skinmatch.core.ImageHandle;

/**
 * 將圖片切成 N×N 格，記錄每格的平均顏色。
 */
public final class SpatialGrid {

    public static final int DEFAULT_GRID = 4;

    private static final double EPSILON = 1e-10;

    private SpatialGrid() {}

    /**
     * @return 長度為 grid*grid*3 的向量，依列優先順序存放每格的 R、G、B 平均值
     */
    public static double[] averageColors(ImageHandle image, int grid) {
        int cellWidth = Math.max(1, image.width() / grid);
        int cellHeight = Math.max(1, image.height() / grid);
        double[] features = new double[grid * grid * 3];
        for (int row = 0; row < grid; row++) {
            for (int col = 0; col < grid; col++) {
                int x0 = Math.min(col * cellWidth, image.width() - 1);
                int y0 = Math.min(row * cellHeight, image.height() - 1);
                int x1 = Math.min(x0 + cellWidth, image.width());
                int y1 = Math.min(y0 + cellHeight, image.height());
                double r = 0, g = 0, b = 0;
                int count = 0;
                for (int y = y0; y < y1; y++) {
                    for (int x = x0; x < x1; x++) {
                        int rgb = image.rgb(x, y);
                        r += (rgb >> 16) & 0xFF;
                        g += (rgb >> 8) & 0xFF;
                        b += rgb & 0xFF;
                        count++;
                    }
                }
                int offset = (row * grid + col) * 3;
                features[offset] = r / count;
                features[offset + 1] = g / count;
                features[offset + 2] = b / count;
            }
        }
        return features;
    }

    /**
     * ‖a-b‖ / (‖a‖+‖b‖)，範圍 [0, 1]；長度不一致時回傳 1.0。
     */
    public static double distance(double[] a, double[] b) {
        if (a.length != b.length) {
            return 1.0;
        }
        double diff = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            diff += d * d;
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        return Math.min(1.0, Math.sqrt(diff) / (Math.sqrt(normA) + Math.sqrt(normB) + EPSILON));
    }
}
