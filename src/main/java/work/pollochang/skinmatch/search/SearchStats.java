package work.pollochang.skinmatch.search;

/**
 * @param total 目錄下的檔案總數
 * @param processed 成功擷取特徵並完成比對的檔案數
 * @param skipped 無法讀取或不是圖片而跳過的檔案數
 */
public record SearchStats(int total, int processed, int skipped) {}
