package work.pollochang.skinmatch.embedding;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.tools.ImageTools;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * 以 ONNX Runtime 執行影像特徵模型 (例如去掉分類層的 ResNet)。
 * 模型輸入為 NCHW float 張量，以 ImageNet 平均值與標準差正規化；輸出攤平成一維向量。
 */
@Slf4j
public final class OnnxEmbeddingBackend implements EmbeddingBackend {

    private static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    private static final float[] STD = {0.229f, 0.224f, 0.225f};
    private static final int DEFAULT_SIZE = 224;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final int inputH;
    private final int inputW;

    private OnnxEmbeddingBackend(Path modelPath) throws OrtException {
        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), new OrtSession.SessionOptions());
        this.inputName = session.getInputNames().iterator().next();

        // 動態尺寸 (-1) 時使用預設值
        NodeInfo info = session.getInputInfo().get(inputName);
        long[] shape = ((TensorInfo) info.getInfo()).getShape();
        this.inputH = shape.length == 4 && shape[2] > 0 ? (int) shape[2] : DEFAULT_SIZE;
        this.inputW = shape.length == 4 && shape[3] > 0 ? (int) shape[3] : DEFAULT_SIZE;
    }

    /**
     * 載入模型；模型不存在或無法載入時回傳不可用的後端，搜尋仍可使用替代公式進行。
     */
    public static EmbeddingBackend open(Path modelPath) {
        if (modelPath == null) {
            return EmbeddingBackend.unavailable();
        }
        if (!Files.isRegularFile(modelPath)) {
            log.warn("{} - 特徵模型不存在，將使用替代公式", modelPath);
            return EmbeddingBackend.unavailable();
        }
        try {
            OnnxEmbeddingBackend backend = new OnnxEmbeddingBackend(modelPath);
            log.info("{} - 特徵模型已載入，輸入尺寸 {}x{}", modelPath, backend.inputW, backend.inputH);
            return backend;
        } catch (OrtException | RuntimeException | UnsatisfiedLinkError e) {
            log.warn("{} - 無法載入特徵模型，將使用替代公式", modelPath, e);
            return EmbeddingBackend.unavailable();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<float[]> embed(ImageHandle image) {
        int[] pixels = ImageTools.resizeArea(image, inputW, inputH);
        int plane = inputW * inputH;
        float[] data = new float[3 * plane];
        for (int i = 0; i < plane; i++) {
            int argb = pixels[i];
            data[i] = (((argb >> 16) & 0xFF) / 255f - MEAN[0]) / STD[0];
            data[plane + i] = (((argb >> 8) & 0xFF) / 255f - MEAN[1]) / STD[1];
            data[2 * plane + i] = ((argb & 0xFF) / 255f - MEAN[2]) / STD[2];
        }

        try (OnnxTensor tensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(data), new long[]{1, 3, inputH, inputW});
             OrtSession.Result result = session.run(Map.of(inputName, tensor))) {
            OnnxValue output = result.get(0);
            if (!(output instanceof OnnxTensor)) {
                log.warn("特徵模型輸出不是張量: {}", output.getType());
                return Optional.empty();
            }
            FloatBuffer buffer = ((OnnxTensor) output).getFloatBuffer();
            if (buffer == null) {
                log.warn("特徵模型輸出不是 float 張量");
                return Optional.empty();
            }
            float[] embedding = new float[buffer.remaining()];
            buffer.get(embedding);
            return Optional.of(embedding);
        } catch (OrtException e) {
            log.warn("特徵模型推論失敗", e);
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            log.error("關閉特徵模型時發生錯誤。", e);
        }
    }
}
