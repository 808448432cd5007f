package work.pollochang.skinmatch.search;

/**
 * 搜尋進度。
 * @param processed 已檢查的候選檔案數 (含跳過的檔案)
 * @param total 候選檔案總數，尚未統計完成時為 0
 * @param message 給使用者看的訊息
 */
public record SearchProgress(int processed, int total, String message) {}
