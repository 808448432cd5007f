package work.pollochang.skinmatch.feature;

/**
 * 粗略的紋理特徵。
 * @param edgeDensity Canny 邊緣像素比例 [0, 1]
 * @param contrast 灰階標準差 [0, 127.5]
 * @param blockVariances 固定大小區塊的灰階變異數
 */
public record TextureSignature(double edgeDensity, double contrast, double[] blockVariances) {

    public TextureSignature {
        blockVariances = blockVariances.clone();
    }

    @Override
    public double[] blockVariances() {
        return blockVariances.clone();
    }
}
