package com.timxs.imageconverter;

import com.timxs.imageconverter.config.ConversionConfig;
import com.timxs.imageconverter.config.ConversionOptions;
import com.timxs.imageconverter.exception.ImageConverterException;
import com.timxs.imageconverter.model.BatchCompleted;
import com.timxs.imageconverter.model.BatchProgress;
import com.timxs.imageconverter.model.BatchResult;
import com.timxs.imageconverter.model.ItemStatus;
import com.timxs.imageconverter.model.MoveResult;
import com.timxs.imageconverter.service.ConversionSession;
import com.timxs.imageconverter.service.SettingsManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 图片批量转换应用入口
 * <p>
 * 用法：{@code [--config=<file.json>] [--move-to=<dir>] <文件或目录>...}
 * 退出码：0 全部成功，1 部分失败，2 参数错误或致命错误
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@Slf4j
@Configuration
@ComponentScan
public class ImageConverterApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_PARTIAL_FAILURE = 1;
    static final int EXIT_ERROR = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * 执行一次转换（可选移动）
     *
     * @param args 命令行参数
     * @return 退出码
     */
    static int run(String[] args) {
        Arguments arguments = Arguments.parse(args);
        if (arguments.sources().isEmpty()) {
            log.error("Usage: image-batch-converter [--config=<file.json>] [--move-to=<dir>] <file-or-dir>...");
            return EXIT_ERROR;
        }

        try (AnnotationConfigApplicationContext context =
                 new AnnotationConfigApplicationContext(ImageConverterApplication.class)) {
            SettingsManager settingsManager = context.getBean(SettingsManager.class);
            ConversionSession session = context.getBean(ConversionSession.class);

            ConversionConfig config = (arguments.config() != null
                ? settingsManager.getConfig(arguments.config())
                : settingsManager.getConfig()).block();

            if (session.addSources(arguments.sources()) == 0) {
                log.error("The given paths didn't include any supported images.");
                return EXIT_ERROR;
            }

            BatchResult result = session.convert(ConversionOptions.from(config))
                .doOnNext(event -> {
                    if (event instanceof BatchProgress progress) {
                        log.info("[{}/{}] {} {}", progress.processed(), progress.total(),
                            progress.status() == ItemStatus.SUCCESS ? "OK  " : "FAIL", progress.source());
                    }
                })
                .ofType(BatchCompleted.class)
                .blockLast()
                .result();
            log.info("Done. Converted {} file(s), {} failed. Output: {}",
                result.successes(), result.failures(), result.outputDir().toAbsolutePath());

            Path moveTo = arguments.moveTo() != null ? arguments.moveTo() : configuredDestination(config);
            if (moveTo != null) {
                MoveResult moved = session.moveConverted(moveTo).block();
                log.info("Moved {} file(s) to: {} ({} remaining)", moved.moved(), moved.destination(), moved.remaining());
            }
            return result.hasFailures() ? EXIT_PARTIAL_FAILURE : EXIT_OK;
        } catch (ImageConverterException | IllegalStateException e) {
            log.error("转换失败: {}", e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static Path configuredDestination(ConversionConfig config) {
        String destination = config.getMoveDestination();
        return destination == null || destination.isBlank() ? null : Paths.get(destination);
    }

    /**
     * 命令行参数
     *
     * @param config  配置文件，未指定为 null
     * @param moveTo  移动目标目录，未指定为 null
     * @param sources 源文件或目录
     */
    record Arguments(Path config, Path moveTo, List<Path> sources) {

        static Arguments parse(String[] args) {
            Path config = null;
            Path moveTo = null;
            List<Path> sources = new ArrayList<>();
            for (String arg : args) {
                if (arg.startsWith("--config=")) {
                    config = Paths.get(arg.substring("--config=".length()));
                } else if (arg.startsWith("--move-to=")) {
                    moveTo = Paths.get(arg.substring("--move-to=".length()));
                } else if (!arg.isBlank()) {
                    sources.add(Paths.get(arg));
                }
            }
            return new Arguments(config, moveTo, List.copyOf(sources));
        }
    }
}
