package work.pollochang.skinmatch.search;

/**
 * 搜尋參數。
 * @param topK 保留的最佳結果數，至少為 1
 * @param algorithm 演算法名稱
 * @param threads 處理候選檔案的執行緒數，1 表示循序處理
 * @param progressInterval 每處理幾個檔案回報一次進度，0 表示使用演算法的建議值
 */
public record SearchParams(int topK, String algorithm, int threads, int progressInterval) {

    public static SearchParams of(int topK, String algorithm) {
        return new SearchParams(topK, algorithm, 1, 0);
    }
}
