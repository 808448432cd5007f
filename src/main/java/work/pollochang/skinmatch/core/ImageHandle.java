package work.pollochang.skinmatch.core;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * 解碼後的圖片，像素以 ARGB 整數 (0xAARRGGBB) 依列優先順序保存。
 * 建立後不可變，對外提供的像素陣列皆為複本。
 */
public final class ImageHandle {

    private final int width;
    private final int height;
    private final boolean alpha;
    private final int[] argb;

    private ImageHandle(int width, int height, boolean alpha, int[] argb) {
        this.width = width;
        this.height = height;
        this.alpha = alpha;
        this.argb = argb;
    }

    public static ImageHandle of(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        return new ImageHandle(width, height, image.getColorModel().hasAlpha(), pixels);
    }

    /**
     * 以 ARGB 像素陣列建立圖片，陣列會被複製。
     */
    public static ImageHandle ofArgb(int width, int height, int[] argb) {
        Objects.requireNonNull(argb, "argb must not be null");
        if (width <= 0 || height <= 0 || argb.length != width * height) {
            throw new IllegalArgumentException("像素數量與尺寸不符: " + width + "x" + height + " / " + argb.length);
        }
        return new ImageHandle(width, height, true, argb.clone());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean hasAlpha() {
        return alpha;
    }

    public int argb(int x, int y) {
        return argb[y * width + x];
    }

    public int rgb(int x, int y) {
        return argb[y * width + x] & 0xFFFFFF;
    }

    public int alpha(int x, int y) {
        return alpha ? (argb[y * width + x] >>> 24) : 0xFF;
    }

    public int[] argbPixels() {
        return argb.clone();
    }

    /**
     * RGB 像素 (0xRRGGBB)，忽略透明度。
     */
    public int[] rgbPixels() {
        int[] rgb = new int[argb.length];
        for (int i = 0; i < argb.length; i++) {
            rgb[i] = argb[i] & 0xFFFFFF;
        }
        return rgb;
    }

    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] pixels = alpha ? argb : opaque(argb);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    private static int[] opaque(int[] source) {
        int[] result = new int[source.length];
        for (int i = 0; i < source.length; i++) {
            result[i] = source[i] | 0xFF000000;
        }
        return result;
    }
}
