package work.pollochang.skinmatch.feature;

import org.junit.jupiter.api.Test;
import work.pollochang.skinmatch.core.ImageHandle;

import static org.junit.jupiter.api.Assertions.*;

class ImageHashesTest {

    /**
     * 左半黑、右半白 (inverted 時相反)
     */
    private ImageHandle halves(int size, boolean inverted) {
        int[] argb = new int[size * size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                boolean right = x >= size / 2;
                argb[y * size + x] = right != inverted ? 0xFFFFFFFF : 0xFF000000;
            }
        }
        return ImageHandle.ofArgb(size, size, argb);
    }

    @Test
    void testAverageHash_HalvesShouldSetRightBits() {
        ImageHash hash = ImageHashes.averageHash(halves(16, false), 8);

        assertEquals(64, hash.length());
        assertFalse(hash.get(0));
        assertTrue(hash.get(7));
    }

    @Test
    void testAverageHash_InvertedImageIsMaximallyDistant() {
        ImageHash a = ImageHashes.averageHash(halves(16, false), 8);
        ImageHash b = ImageHashes.averageHash(halves(16, true), 8);

        assertEquals(0, a.hammingDistance(a));
        assertEquals(64, a.hammingDistance(b));
        assertEquals(1.0, a.distanceTo(b));
    }

    @Test
    void testDifferentLengths_ShouldBeWorstDistance() {
        ImageHash small = ImageHashes.averageHash(halves(16, false), 4);
        ImageHash large = ImageHashes.averageHash(halves(16, false), 8);

        assertEquals(1.0, small.distanceTo(large));
    }
}
