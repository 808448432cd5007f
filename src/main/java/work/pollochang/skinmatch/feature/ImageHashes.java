package work.pollochang.skinmatch.feature;

import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.tools.ImageTools;

import java.util.BitSet;

/**
 * 平均雜湊 (aHash)。
 */
public final class ImageHashes {

    private ImageHashes() {}

    /**
     * 縮成 size×size 灰階，亮度大於平均值的格子為 1。
     */
    public static ImageHash averageHash(ImageHandle image, int size) {
        double[] gray = ImageTools.grayscale(image, size, size);
        double mean = 0;
        for (double v : gray) {
            mean += v;
        }
        mean /= gray.length;

        BitSet bits = new BitSet(gray.length);
        for (int i = 0; i < gray.length; i++) {
            if (gray[i] > mean) {
                bits.set(i);
            }
        }
        return new ImageHash(bits, gray.length);
    }
}
