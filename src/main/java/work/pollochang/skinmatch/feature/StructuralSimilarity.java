package work.pollochang.skinmatch.feature;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.tools.ImageTools;

/**
 * 結構相似度 (SSIM)，在固定解析度的灰階圖上以滑動視窗計算。
 */
public final class StructuralSimilarity {

    public static final int SIZE = 64;
    public static final int WINDOW = 7;

    private static final double C1 = (0.01 * 255) * (0.01 * 255);
    private static final double C2 = (0.03 * 255) * (0.03 * 255);

    private StructuralSimilarity() {}

    /**
     * 縮放到 {@link #SIZE}×{@link #SIZE} 的灰階像素，供 {@link #ssim(double[], double[])} 使用。
     */
    public static double[] prepare(ImageHandle image) {
        return ImageTools.grayscale(image, SIZE, SIZE);
    }

    /**
     * 兩張已縮放灰階圖的平均 SSIM，範圍 [-1, 1]，1 代表完全相同。
     */
    public static double ssim(double[] a, double[] b) {
        if (a.length != SIZE * SIZE || b.length != SIZE * SIZE) {
            throw new IllegalArgumentException("灰階圖尺寸必須為 " + SIZE + "x" + SIZE);
        }
        int n = WINDOW * WINDOW;
        double total = 0;
        int windows = 0;
        for (int y = 0; y + WINDOW <= SIZE; y++) {
            for (int x = 0; x + WINDOW <= SIZE; x++) {
                double sumA = 0, sumB = 0, sumAA = 0, sumBB = 0, sumAB = 0;
                for (int wy = y; wy < y + WINDOW; wy++) {
                    for (int wx = x; wx < x + WINDOW; wx++) {
                        double va = a[wy * SIZE + wx];
                        double vb = b[wy * SIZE + wx];
                        sumA += va;
                        sumB += vb;
                        sumAA += va * va;
                        sumBB += vb * vb;
                        sumAB += va * vb;
                    }
                }
                double muA = sumA / n;
                double muB = sumB / n;
                double varA = sumAA / n - muA * muA;
                double varB = sumBB / n - muB * muB;
                double cov = sumAB / n - muA * muB;
                total += ((2 * muA * muB + C1) * (2 * cov + C2))
                        / ((muA * muA + muB * muB + C1) * (varA + varB + C2));
                windows++;
            }
        }
        return total / windows;
    }

    /**
     * 1 - SSIM，截斷到 [0, 1]。
     */
    public static double distance(double[] a, double[] b) {
        return Math.max(0.0, Math.min(1.0, 1.0 - ssim(a, b)));
    }
}
