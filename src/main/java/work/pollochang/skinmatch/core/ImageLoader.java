package work.pollochang.skinmatch.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;

/**
 * 圖片解碼工具類
 */
@Slf4j
public final class ImageLoader {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    // 超過此邊長的圖片以二次取樣讀取，降低記憶體使用
    private static final int PREFERRED_MAX_DIM = 4096;

    private ImageLoader() {}

    /**
     * 讀取並解碼圖片。
     * @param path 圖片路徑
     * @return 解碼後的圖片
     * @throws ImageReadException 檔案不存在、無法讀取、格式不支援或記憶體不足
     */
    public static ImageHandle load(Path path) throws ImageReadException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ImageReadException(path, FailureReason.NOT_FOUND);
        }

        try (InputStream raw = Files.newInputStream(path);
             ImageInputStream in = ImageIO.createImageInputStream(raw)) {
            if (in == null) {
                throw new ImageReadException(path, FailureReason.UNREADABLE);
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new ImageReadException(path, FailureReason.UNSUPPORTED_FORMAT);
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                ImageReadParam param = reader.getDefaultReadParam();

                int maxDim = Math.max(reader.getWidth(0), reader.getHeight(0));
                if (maxDim > PREFERRED_MAX_DIM) {
                    // 取樣率取 2 的冪，對某些解碼器更友好
                    int subsampling = Integer.highestOneBit(maxDim / PREFERRED_MAX_DIM);
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", path, subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                try {
                    return ImageHandle.of(image);
                } finally {
                    image.flush();
                }
            } finally {
                reader.dispose();
            }
        } catch (ImageReadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // 截斷的檔案、錯誤的標頭等，各解碼器拋出的例外型別不一
            throw new ImageReadException(path, FailureReason.UNREADABLE, e);
        } catch (OutOfMemoryError e) {
            log.warn("{} - 解碼時發生記憶體溢位 (圖片可能過大)", path);
            throw new ImageReadException(path, FailureReason.OUT_OF_MEMORY, e);
        }
    }
}
