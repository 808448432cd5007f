package work.pollochang.skinmatch.algorithm;

import org.junit.jupiter.api.Test;
import work.pollochang.skinmatch.TestImages;
import work.pollochang.skinmatch.core.ConfigurationException;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.embedding.EmbeddingBackend;

import java.awt.*;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlgorithmRegistryTest {

    private final AlgorithmRegistry registry = AlgorithmRegistry.createDefault(EmbeddingBackend.unavailable());

    @Test
    void testDefaultRegistry_ContainsAllAlgorithms() {
        List<String> names = new ArrayList<>();
        registry.all().forEach(algorithm -> names.add(algorithm.name()));

        assertEquals(List.of("render_to_skin", "render_match", "balanced", "color_frequency",
                "skin_optimized", "deep_features", "color_distribution", "fast", "ai_perceptual"), names);
        assertEquals(names.size(), registry.displayNames().size());
    }

    @Test
    void testWeights_ShouldSumToOne() {
        for (MatchingAlgorithm algorithm : registry.all()) {
            double sum = algorithm.weights().values().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(1.0, sum, 1e-9, algorithm.name());
        }
    }

    /**
     * 任何演算法比對同一張圖片的距離都應為 0
     */
    @Test
    void testScoringIsReflexive_ForEveryAlgorithm() {
        List<ImageHandle> images = List.of(
                TestImages.noise(64, 64, 21L),
                TestImages.noise(37, 90, 22L),
                TestImages.solidHandle(64, 32, Color.MAGENTA),
                TestImages.checkerboard(48, 6),
                ImageHandle.ofArgb(64, 64, new int[64 * 64]));
        for (MatchingAlgorithm algorithm : registry.all()) {
            for (ImageHandle image : images) {
                FeatureBundle features = algorithm.extract(image);
                Similarity similarity = algorithm.score(features, features);
                assertEquals(0.0, similarity.distance(), 1e-9,
                        algorithm.name() + " " + image.width() + "x" + image.height());
            }
        }
    }

    /**
     * 修改取出的陣列不應影響之後的比對結果
     */
    @Test
    void testFeatures_ShouldNotChangeThroughReturnedArrays() {
        BalancedAlgorithm balanced = new BalancedAlgorithm();
        BalancedAlgorithm.Features red =
                (BalancedAlgorithm.Features) balanced.extract(TestImages.solidHandle(64, 64, Color.RED));
        FeatureBundle blue = balanced.extract(TestImages.solidHandle(64, 64, Color.BLUE));
        double before = balanced.score(red, blue).distance();

        Arrays.fill(red.histogram(), 0.0);
        red.colors().colors()[0] = 0x0000F0;
        red.colors().weights()[0] = 0.0;

        assertEquals(before, balanced.score(red, blue).distance());
        assertEquals(0.0, balanced.score(red, red).distance(), 1e-9);
        assertEquals(0xF00000, red.colors().colors()[0]);
    }

    @Test
    void testDistances_ShouldStayInUnitRange() {
        ImageHandle a = TestImages.noise(64, 64, 31L);
        ImageHandle b = TestImages.checkerboard(64, 4);
        for (MatchingAlgorithm algorithm : registry.all()) {
            double distance = algorithm.score(algorithm.extract(a), algorithm.extract(b)).distance();
            assertTrue(distance >= 0.0 && distance <= 1.0, algorithm.name() + " " + distance);
        }
    }

    @Test
    void testUnknownAlgorithm_ShouldThrowConfigurationException() {
        assertTrue(registry.find("nope").isEmpty());
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.require("nope"));
        assertTrue(e.getMessage().contains("balanced"));
    }

    @Test
    void testDuplicateRegistration_ShouldFail() {
        AlgorithmRegistry.Builder builder = AlgorithmRegistry.builder().register(new BalancedAlgorithm());

        assertThrows(IllegalStateException.class, () -> builder.register(new BalancedAlgorithm()));
    }

    @Test
    void testMismatchedFeatures_ShouldThrowIllegalArgumentException() {
        ImageHandle image = TestImages.noise(16, 16, 1L);
        MatchingAlgorithm balanced = registry.require(BalancedAlgorithm.NAME);
        MatchingAlgorithm fast = registry.require(FastMatchAlgorithm.NAME);

        FeatureBundle balancedFeatures = balanced.extract(image);

        assertThrows(IllegalArgumentException.class, () -> fast.score(balancedFeatures, fast.extract(image)));
    }

    @Test
    void testBalanced_RedAndBlueAreFarApart() {
        MatchingAlgorithm balanced = registry.require(BalancedAlgorithm.NAME);
        FeatureBundle red = balanced.extract(TestImages.solidHandle(64, 64, Color.RED));
        FeatureBundle blue = balanced.extract(TestImages.solidHandle(64, 64, Color.BLUE));

        Similarity similarity = balanced.score(red, blue);

        assertTrue(similarity.distance() > 0.5, "distance=" + similarity.distance());
        assertTrue(similarity.metrics().containsKey("color_dist"));
        assertTrue(similarity.metrics().containsKey("hist_dist"));
        assertTrue(similarity.metrics().containsKey("hash_dist"));
    }

    @Test
    void testSkinOptimized_SkinTexturesIgnoreDimensions() {
        MatchingAlgorithm algorithm = registry.require(SkinOptimizedAlgorithm.NAME);
        FeatureBundle wide = algorithm.extract(TestImages.solidHandle(64, 64, Color.RED));
        FeatureBundle legacy = algorithm.extract(TestImages.solidHandle(64, 32, Color.RED));
        FeatureBundle other = algorithm.extract(TestImages.solidHandle(50, 80, Color.RED));

        assertEquals(0.0, algorithm.score(wide, legacy).metrics().get("dim_dist"));
        assertTrue(algorithm.score(wide, other).metrics().get("dim_dist") > 0);
    }

    @Test
    void testColorFrequency_ReportsOverlap() {
        MatchingAlgorithm algorithm = registry.require(ColorFrequencyAlgorithm.NAME);
        FeatureBundle a = algorithm.extract(ImageHandle.ofArgb(2, 1, new int[]{0xFFFF0000, 0xFF00FF00}));
        FeatureBundle b = algorithm.extract(ImageHandle.ofArgb(2, 1, new int[]{0xFFFF0000, 0xFF0000FF}));

        Similarity similarity = algorithm.score(a, b);

        assertEquals(0.5, similarity.distance(), 1e-12);
        assertEquals(1.0, similarity.metrics().get("color_overlap"));
        assertEquals(2.0, similarity.metrics().get("unique_colors_1"));
    }
}
