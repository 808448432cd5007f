package work.pollochang.skinmatch.core;

/**
 * 搜尋參數錯誤 (未知演算法、K 小於 1、搜尋目錄不存在等)，在走訪目錄之前即拋出。
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
