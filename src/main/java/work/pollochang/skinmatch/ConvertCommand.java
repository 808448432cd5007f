package work.pollochang.skinmatch;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import work.pollochang.skinmatch.converter.RenderToSkinConverter;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.core.ImageLoader;
import work.pollochang.skinmatch.core.ImageReadException;
import work.pollochang.skinmatch.tools.FileTools;

import javax.imageio.ImageIO;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "convert",
        mixinStandardHelpOptions = true,
        description = "將角色渲染圖轉換為 64x64 皮膚貼圖。")
public class ConvertCommand implements Callable<Integer> {

    @Mixin
    private LoggingOptions loggingOptions;

    @Option(names = {"-i", "--input"}, required = true, description = "角色渲染圖。")
    private File input;

    @Option(names = {"-o", "--output"}, required = true, description = "輸出的皮膚貼圖 (PNG)。")
    private File output;

    @Override
    public Integer call() {
        Path inputPath = input.toPath();
        Path outputPath = output.toPath().toAbsolutePath();
        try {
            ImageHandle render = ImageLoader.load(inputPath);
            ImageHandle skin = RenderToSkinConverter.convert(render);
            if (outputPath.getParent() != null) {
                FileTools.ensureDirectoryExists(outputPath.getParent());
            }
            ImageIO.write(skin.toBufferedImage(), "png", outputPath.toFile());
            log.info("{} - 已轉換為皮膚貼圖 {} ({}x{} -> {}x{})", inputPath, outputPath,
                    render.width(), render.height(), skin.width(), skin.height());
            return 0;
        } catch (ImageReadException e) {
            log.error("{} - 無法讀取圖片: {}", e.getPath(), e.getReason().getDescription());
            return SearchBatch.EXIT_INVALID_INPUT;
        } catch (IOException e) {
            log.error("{} - 寫入失敗", outputPath, e);
            return SearchBatch.EXIT_INVALID_INPUT;
        }
    }
}
