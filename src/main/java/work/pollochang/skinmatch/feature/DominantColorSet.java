package work.pollochang.skinmatch.feature;

/**
 * 主要色集合，依出現頻率由高至低排序。
 * @param colors 量化後的顏色 (0xRRGGBB)
 * @param weights 各顏色的權重，總和為 1.0 (空集合時為空陣列)
 */
public record DominantColorSet(int[] colors, double[] weights) {

    private static final DominantColorSet EMPTY = new DominantColorSet(new int[0], new double[0]);

    public DominantColorSet {
        if (colors.length != weights.length) {
            throw new IllegalArgumentException("colors 與 weights 長度不一致");
        }
        colors = colors.clone();
        weights = weights.clone();
    }

    @Override
    public int[] colors() {
        return colors.clone();
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }

    public static DominantColorSet empty() {
        return EMPTY;
    }

    public int size() {
        return colors.length;
    }

    public boolean isEmpty() {
        return colors.length == 0;
    }
}
