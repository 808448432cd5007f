package work.pollochang.skinmatch.algorithm;

import work.pollochang.skinmatch.core.ImageHandle;

import java.util.Map;

/**
 * 比對演算法：定義要擷取的特徵與加權距離公式。
 * 實作必須是無狀態的，可被多個執行緒同時使用。
 */
public interface MatchingAlgorithm {

    /** 內部名稱，作為註冊表的鍵與特徵的標籤 */
    String name();

    String displayName();

    String description();

    /** 各項距離的權重，依顯示順序排列，總和為 1.0 */
    Map<String, Double> weights();

    FeatureBundle extract(ImageHandle image);

    /**
     * 計算 query → candidate 的距離。兩者必須由本演算法產生，否則拋出 {@link IllegalArgumentException}。
     */
    Similarity score(FeatureBundle query, FeatureBundle candidate);

    /**
     * 建議的進度回報間隔 (每處理幾個候選檔案回報一次)。
     */
    default int progressInterval() {
        return 100;
    }

    /**
     * 將特徵轉型為指定型別，標籤不符時拋出 {@link IllegalArgumentException}。
     */
    default <T extends FeatureBundle> T features(FeatureBundle bundle, Class<T> type) {
        if (bundle == null || !name().equals(bundle.algorithm()) || !type.isInstance(bundle)) {
            throw new IllegalArgumentException("演算法 " + name() + " 無法比對標籤為 "
                    + (bundle == null ? "null" : bundle.algorithm()) + " 的特徵");
        }
        return type.cast(bundle);
    }
}
