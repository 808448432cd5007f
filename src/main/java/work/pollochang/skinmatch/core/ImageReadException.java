package work.pollochang.skinmatch.core;

import lombok.Getter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 單一圖片無法解碼時拋出，搜尋流程會將該候選檔案計為跳過。
 */
@Getter
public class ImageReadException extends IOException {

    private final Path path;
    private final FailureReason reason;

    public ImageReadException(Path path, FailureReason reason) {
        super(path + " - " + reason.getDescription());
        this.path = path;
        this.reason = reason;
    }

    public ImageReadException(Path path, FailureReason reason, Throwable cause) {
        super(path + " - " + reason.getDescription(), cause);
        this.path = path;
        this.reason = reason;
    }
}
