package work.pollochang.skinmatch.feature;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.tools.ImageTools;

/**
 * 邊緣密度、對比與區塊變異數。
 */
public final class TextureStatistics {

    /** 邊緣偵測前統一縮放的邊長 */
    public static final int EDGE_SIZE = 64;
    /** Canny 遲滯門檻 */
    public static final double CANNY_LOW_THRESHOLD = 50.0;
    public static final double CANNY_HIGH_THRESHOLD = 150.0;
    public static final int BLOCK_SIZE = 8;
    /** 區塊變異數在此解析度上計算，得到 4×4 個區塊 */
    public static final int BLOCK_GRID_SIZE = 32;

    private TextureStatistics() {}

    public static TextureSignature signature(ImageHandle image) {
        return new TextureSignature(
                edgeDensity(image),
                contrast(image),
                blockVariance(ImageTools.grayscale(image, BLOCK_GRID_SIZE, BLOCK_GRID_SIZE),
                        BLOCK_GRID_SIZE, BLOCK_GRID_SIZE, BLOCK_SIZE));
    }

    /**
     * 縮放到 64×64 灰階後以 Canny 偵測邊緣，回傳邊緣像素所佔比例。
     */
    public static double edgeDensity(ImageHandle image) {
        double[] gray = ImageTools.grayscale(image, EDGE_SIZE, EDGE_SIZE);
        byte[] data = new byte[gray.length];
        for (int i = 0; i < gray.length; i++) {
            data[i] = (byte) Math.round(gray[i]);
        }

        OpenCV.loadShared();
        Mat source = new Mat(EDGE_SIZE, EDGE_SIZE, CvType.CV_8UC1);
        Mat edges = new Mat();
        try {
            source.put(0, 0, data);
            Imgproc.Canny(source, edges, CANNY_LOW_THRESHOLD, CANNY_HIGH_THRESHOLD);
            return (double) Core.countNonZero(edges) / (EDGE_SIZE * EDGE_SIZE);
        } finally {
            source.release();
            edges.release();
        }
    }

    /**
     * 以三通道平均作為灰階，回傳整張圖的標準差。
     */
    public static double contrast(ImageHandle image) {
        int[] pixels = image.rgbPixels();
        double sum = 0;
        double sumSq = 0;
        for (int rgb : pixels) {
            double v = (((rgb >> 16) & 0xFF) + ((rgb >> 8) & 0xFF) + (rgb & 0xFF)) / 3.0;
            sum += v;
            sumSq += v * v;
        }
        double mean = sum / pixels.length;
        return Math.sqrt(Math.max(0, sumSq / pixels.length - mean * mean));
    }

    /**
     * 以 block×block 的不重疊區塊計算灰階變異數，邊緣不足一個區塊的部分捨棄。
     */
    public static double[] blockVariance(double[] gray, int width, int height, int block) {
        int cols = width / block;
        int rows = height / block;
        double[] variances = new double[cols * rows];
        int count = block * block;
        for (int by = 0; by < rows; by++) {
            for (int bx = 0; bx < cols; bx++) {
                double sum = 0;
                double sumSq = 0;
                for (int y = by * block; y < (by + 1) * block; y++) {
                    for (int x = bx * block; x < (bx + 1) * block; x++) {
                        double v = gray[y * width + x];
                        sum += v;
                        sumSq += v * v;
                    }
                }
                double mean = sum / count;
                variances[by * cols + bx] = Math.max(0, sumSq / count - mean * mean);
            }
        }
        return variances;
    }

    /**
     * 兩組區塊變異數的平均絕對差，以最大可能變異數 (127.5²) 正規化。
     */
    public static double blockVarianceDistance(double[] v1, double[] v2) {
        if (v1.length != v2.length || v1.length == 0) {
            return 1.0;
        }
        double maxVariance = 127.5 * 127.5;
        double sum = 0;
        for (int i = 0; i < v1.length; i++) {
            sum += Math.abs(v1[i] - v2[i]);
        }
        return Math.min(1.0, sum / v1.length / maxVariance);
    }
}
