package work.pollochang.skinmatch.feature;

import java.util.BitSet;

/**
 * 二值化的圖片雜湊。
 */
public final class ImageHash {

    private final BitSet bits;
    private final int length;

    ImageHash(BitSet bits, int length) {
        this.bits = (BitSet) bits.clone();
        this.length = length;
    }

    public int length() {
        return length;
    }

    public boolean get(int index) {
        return bits.get(index);
    }

    public int hammingDistance(ImageHash other) {
        BitSet xor = (BitSet) bits.clone();
        xor.xor(other.bits);
        return xor.cardinality();
    }

    /**
     * 漢明距離除以位元數，範圍 [0, 1]；位元數不同時回傳 1.0。
     */
    public double distanceTo(ImageHash other) {
        if (length != other.length || length == 0) {
            return 1.0;
        }
        return (double) hammingDistance(other) / length;
    }
}
