package work.pollochang.skinmatch.search;

public enum SearchStatus {
    COMPLETED("搜尋完成"),
    CANCELLED("使用者取消");

    private final String description;
    SearchStatus(String description) { this.description = description; }
    public String getDescription() { return description; }
}
