package work.pollochang.skinmatch.core;

public enum FailureReason {
    NOT_FOUND("來源檔案不存在"),
    UNREADABLE("檔案無法讀取或已損毀"),
    UNSUPPORTED_FORMAT("格式不支援"),
    OUT_OF_MEMORY("記憶體溢位");

    private final String description;
    FailureReason(String description) { this.description = description; }
    public String getDescription() { return description; }
}
