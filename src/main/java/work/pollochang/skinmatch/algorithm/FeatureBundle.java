package work.pollochang.skinmatch.algorithm;

/**
 * 單一圖片針對某個演算法擷取出的特徵。
 * 每個實作都帶有產生它的演算法名稱，比對時據此分派。
 */
public interface FeatureBundle {

    String algorithm();
}
