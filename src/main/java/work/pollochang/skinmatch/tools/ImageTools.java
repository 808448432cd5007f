package work.pollochang.skinmatch.tools;

import work.pollochang.skinmatch.core.ImageHandle;

/**
 * 像素層級的影像工具：面積平均縮放、裁切、灰階轉換。
 */
public final class ImageTools {

    private ImageTools() {}

    /**
     * 將整張圖片以面積平均法縮放到指定尺寸。
     */
    public static int[] resizeArea(ImageHandle image, int targetWidth, int targetHeight) {
        return resizeArea(image, 0, 0, image.width(), image.height(), targetWidth, targetHeight);
    }

    /**
     * 裁切來源區域 [x0, x1) x [y0, y1) 並以面積平均法縮放到指定尺寸 (ARGB 各通道獨立平均)。
     * 來源區域為空時回傳全透明像素。
     */
    public static int[] resizeArea(ImageHandle image, int x0, int y0, int x1, int y1,
                                   int targetWidth, int targetHeight) {
        int[] result = new int[targetWidth * targetHeight];
        int regionWidth = x1 - x0;
        int regionHeight = y1 - y0;
        if (regionWidth <= 0 || regionHeight <= 0) {
            return result;
        }

        double scaleX = (double) regionWidth / targetWidth;
        double scaleY = (double) regionHeight / targetHeight;

        for (int dy = 0; dy < targetHeight; dy++) {
            double sy0 = dy * scaleY;
            double sy1 = sy0 + scaleY;
            for (int dx = 0; dx < targetWidth; dx++) {
                double sx0 = dx * scaleX;
                double sx1 = sx0 + scaleX;

                double a = 0, r = 0, g = 0, b = 0, area = 0;
                for (int sy = (int) sy0; sy < sy1 && sy < regionHeight; sy++) {
                    double wy = Math.min(sy1, sy + 1) - Math.max(sy0, sy);
                    if (wy <= 0) {
                        continue;
                    }
                    for (int sx = (int) sx0; sx < sx1 && sx < regionWidth; sx++) {
                        double wx = Math.min(sx1, sx + 1) - Math.max(sx0, sx);
                        if (wx <= 0) {
                            continue;
                        }
                        double weight = wx * wy;
                        int argb = image.argb(x0 + sx, y0 + sy);
                        int alpha = image.hasAlpha() ? (argb >>> 24) : 0xFF;
                        a += weight * alpha;
                        r += weight * ((argb >> 16) & 0xFF);
                        g += weight * ((argb >> 8) & 0xFF);
                        b += weight * (argb & 0xFF);
                        area += weight;
                    }
                }
                if (area > 0) {
                    result[dy * targetWidth + dx] = pack(
                            (int) Math.round(a / area),
                            (int) Math.round(r / area),
                            (int) Math.round(g / area),
                            (int) Math.round(b / area));
                }
            }
        }
        return result;
    }

    /**
     * 縮放後轉成灰階 (ITU-R 601-2 luma，與常見影像函式庫的 L 模式一致)。
     */
    public static double[] grayscale(ImageHandle image, int targetWidth, int targetHeight) {
        int[] pixels = resizeArea(image, targetWidth, targetHeight);
        double[] gray = new double[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            gray[i] = luma(pixels[i]);
        }
        return gray;
    }

    public static double luma(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return r * 299 / 1000.0 + g * 587 / 1000.0 + b * 114 / 1000.0;
    }

    /**
     * 水平鏡像。
     */
    public static int[] mirror(int[] pixels, int width, int height) {
        int[] result = new int[pixels.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                result[y * width + x] = pixels[y * width + (width - 1 - x)];
            }
        }
        return result;
    }

    public static int pack(int a, int r, int g, int b) {
        return (clamp(a) << 24) | (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }
}
