package work.pollochang.skinmatch.feature;

import org.junit.jupiter.api.Test;
import work.pollochang.skinmatch.TestImages;

import java.awt.*;

import static org.junit.jupiter.api.Assertions.*;

class StructuralSimilarityTest {

    @Test
    void testIdenticalImages_ShouldHaveSsimOne() {
        double[] gray = StructuralSimilarity.prepare(TestImages.checkerboard(64, 8));

        assertEquals(1.0, StructuralSimilarity.ssim(gray, gray), 1e-9);
        assertEquals(0.0, StructuralSimilarity.distance(gray, gray), 1e-9);
    }

    @Test
    void testStructureDifference_ShouldIncreaseDistance() {
        double[] board = StructuralSimilarity.prepare(TestImages.checkerboard(128, 16));
        double[] flat = StructuralSimilarity.prepare(TestImages.solidHandle(128, 128, Color.GRAY));

        double distance = StructuralSimilarity.distance(board, flat);

        assertTrue(distance > 0.5, "distance=" + distance);
        assertTrue(distance <= 1.0);
    }

    @Test
    void testWrongSize_ShouldThrowIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class,
                () -> StructuralSimilarity.ssim(new double[16], new double[16]));
    }
}
