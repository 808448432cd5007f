package work.pollochang.skinmatch.feature;

/**
 * 學習式特徵向量的距離。
 */
public final class Embeddings {

    private Embeddings() {}

    /**
     * 餘弦距離 (1 - cos) / 2，範圍 [0, 1]。
     * 長度不同或任一向量為零向量時回傳 1.0。
     */
    public static double cosineDistance(float[] a, float[] b) {
        if (a.length != b.length || a.length == 0) {
            return 1.0;
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 1.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, Math.min(1.0, (1.0 - cosine) / 2.0));
    }
}
