package work.pollochang.skinmatch.embedding;

import work.pollochang.skinmatch.core.ImageHandle;

import java.util.Optional;

/**
 * 產生圖片特徵向量的外部模型。
 * 是否可用在建立時就已決定，之後不會改變。
 */
public interface EmbeddingBackend extends AutoCloseable {

    boolean isAvailable();

    /**
     * @return 固定長度的特徵向量；後端不可用或單張圖片推論失敗時為空
     */
    Optional<float[]> embed(ImageHandle image);

    @Override
    default void close() {
    }

    static EmbeddingBackend unavailable() {
        return UnavailableBackend.INSTANCE;
    }

    enum UnavailableBackend implements EmbeddingBackend {
        INSTANCE;

        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public Optional<float[]> embed(ImageHandle image) {
            return Optional.empty();
        }
    }
}
