package work.pollochang.skinmatch.algorithm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import work.pollochang.skinmatch.TestImages;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.embedding.EmbeddingBackend;

import java.awt.*;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingAlgorithmTest {

    @Mock
    private EmbeddingBackend backend;

    private final ImageHandle red = TestImages.solidHandle(16, 16, Color.RED);
    private final ImageHandle blue = TestImages.solidHandle(16, 16, Color.BLUE);

    @Test
    void whenBackendAvailableThenUsesEmbeddingDistance() {
        when(backend.isAvailable()).thenReturn(true);
        when(backend.embed(same(red))).thenReturn(Optional.of(new float[]{1f, 0f}));
        when(backend.embed(same(blue))).thenReturn(Optional.of(new float[]{0f, 1f}));
        EmbeddingAlgorithm algorithm = new EmbeddingAlgorithm(backend);

        Similarity similarity = algorithm.score(algorithm.extract(red), algorithm.extract(blue));

        assertTrue(algorithm.isEmbeddingAvailable());
        assertEquals(0.5, similarity.metrics().get("ai_dist"), 1e-9);
        assertFalse(similarity.metrics().containsKey(EmbeddingAlgorithm.FALLBACK_METRIC));
        double expected = 0.50 * 0.5
                + 0.35 * similarity.metrics().get("color_dist")
                + 0.15 * similarity.metrics().get("hist_dist");
        assertEquals(expected, similarity.distance(), 1e-9);
    }

    @Test
    void whenBackendUnavailableThenUsesFallbackAndFlagsIt() {
        when(backend.isAvailable()).thenReturn(false);
        EmbeddingAlgorithm algorithm = new EmbeddingAlgorithm(backend);

        Similarity similarity = algorithm.score(algorithm.extract(red), algorithm.extract(blue));

        assertEquals(1.0, similarity.metrics().get(EmbeddingAlgorithm.FALLBACK_METRIC));
        assertFalse(similarity.metrics().containsKey("ai_dist"));
        double expected = 0.60 * similarity.metrics().get("color_dist")
                + 0.40 * similarity.metrics().get("hist_dist");
        assertEquals(expected, similarity.distance(), 1e-9);
        verify(backend, never()).embed(any());
    }

    /**
     * 單張圖片推論失敗時，該組比對改用替代公式
     */
    @Test
    void whenOneEmbeddingMissingThenFallsBackForThatPair() {
        when(backend.isAvailable()).thenReturn(true);
        when(backend.embed(same(red))).thenReturn(Optional.of(new float[]{1f, 0f}));
        when(backend.embed(same(blue))).thenReturn(Optional.empty());
        EmbeddingAlgorithm algorithm = new EmbeddingAlgorithm(backend);

        Similarity similarity = algorithm.score(algorithm.extract(red), algorithm.extract(blue));

        assertEquals(1.0, similarity.metrics().get(EmbeddingAlgorithm.FALLBACK_METRIC));
    }

    @Test
    void availabilityIsCheckedOnce() {
        when(backend.isAvailable()).thenReturn(true);
        when(backend.embed(any())).thenReturn(Optional.of(new float[]{1f, 1f}));
        EmbeddingAlgorithm algorithm = new EmbeddingAlgorithm(backend);

        algorithm.extract(red);
        algorithm.extract(blue);
        algorithm.extract(red);

        verify(backend, times(1)).isAvailable();
        assertEquals(10, algorithm.progressInterval());
    }
}
