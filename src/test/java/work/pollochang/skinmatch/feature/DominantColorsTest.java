package work.pollochang.skinmatch.feature;

import org.junit.jupiter.api.Test;
import work.pollochang.skinmatch.TestImages;
import work.pollochang.skinmatch.core.ImageHandle;

import java.awt.*;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DominantColorsTest {

    @Test
    void testWeightsSumToOne_AndSizeBoundedByN() {
        ImageHandle image = TestImages.noise(32, 32, 7L);

        DominantColorSet set = DominantColors.extract(image, 12, true);

        assertEquals(12, set.size());
        assertEquals(1.0, Arrays.stream(set.weights()).sum(), 1e-9);
        for (int i = 1; i < set.size(); i++) {
            assertTrue(set.weights()[i - 1] >= set.weights()[i]);
        }
    }

    @Test
    void testFewerColorsThanRequested_ShouldReturnAllColors() {
        DominantColorSet set = DominantColors.extract(TestImages.solidHandle(4, 4, Color.RED), 12, true);

        assertEquals(1, set.size());
        assertEquals(0xF00000, set.colors()[0]);
        assertEquals(1.0, set.weights()[0], 1e-12);
    }

    /**
     * 透明像素在 respectAlpha 時不列入統計
     */
    @Test
    void testTransparentPixels_ShouldBeExcludedWhenRespectingAlpha() {
        int[] argb = {0x00FF0000, 0x00FF0000, 0x00FF0000, 0xFF0000FF};
        ImageHandle image = ImageHandle.ofArgb(2, 2, argb);

        DominantColorSet respecting = DominantColors.extract(image, 5, true);
        DominantColorSet ignoring = DominantColors.extract(image, 5, false);

        assertArrayEquals(new int[]{0x0000F0}, respecting.colors());
        assertArrayEquals(new int[]{0xF00000, 0x0000F0}, ignoring.colors());
        assertEquals(0.75, ignoring.weights()[0], 1e-12);
    }

    /**
     * 全透明圖片沒有主要色，與有色圖片距離最大，與自己距離為 0
     */
    @Test
    void testFullyTransparentImage_ShouldGiveEmptySet() {
        ImageHandle image = ImageHandle.ofArgb(2, 2, new int[]{0, 0, 0, 0});

        DominantColorSet set = DominantColors.extract(image, 5, true);

        assertTrue(set.isEmpty());
        DominantColorSet other = DominantColors.extract(TestImages.solidHandle(2, 2, Color.RED), 5, true);
        assertEquals(1.0, DominantColors.paletteDistance(set, other));
        assertEquals(1.0, DominantColors.paletteDistance(other, set));
        assertEquals(0.0, DominantColors.paletteDistance(set, set));
        assertEquals(0.0, DominantColors.paletteDistance(set, DominantColorSet.empty()));
    }

    /**
     * 出現次數相同時以量化後的顏色值排序
     */
    @Test
    void testTies_ShouldBreakByQuantizedColor() {
        int[] argb = {0xFFFF0000, 0xFF0000FF, 0xFFFF0000, 0xFF0000FF};
        ImageHandle image = ImageHandle.ofArgb(2, 2, argb);

        DominantColorSet first = DominantColors.extract(image, 2, true);
        DominantColorSet second = DominantColors.extract(image, 2, true);

        assertArrayEquals(new int[]{0x0000F0, 0xF00000}, first.colors());
        assertArrayEquals(first.colors(), second.colors());
    }

    @Test
    void testPaletteDistance_SelfIsZero() {
        DominantColorSet set = DominantColors.extract(TestImages.noise(16, 16, 3L), 12, true);

        assertEquals(0.0, DominantColors.paletteDistance(set, set));
    }

    @Test
    void testPaletteDistance_BlackToWhite() {
        DominantColorSet black = DominantColors.extract(TestImages.solidHandle(2, 2, Color.BLACK), 1, true);
        DominantColorSet white = DominantColors.extract(TestImages.solidHandle(2, 2, Color.WHITE), 1, true);

        assertEquals(240.0 / 255.0, DominantColors.paletteDistance(black, white), 1e-9);
    }

    @Test
    void testZeroColorsRequested_ShouldGiveEmptySet() {
        assertTrue(DominantColors.extract(TestImages.solidHandle(2, 2, Color.RED), 0, true).isEmpty());
    }
}
