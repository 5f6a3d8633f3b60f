package com.timxs.imageconverter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.spi.IIORegistry;
import javax.imageio.spi.IIOServiceProvider;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.spi.ImageWriterSpi;
import java.util.ArrayList;
import java.util.List;

/**
 * ImageIO 插件注册器
 * 应用启动时确保 WebP 的 Reader/Writer SPI 已注册，停止时注销自己注册的 SPI
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@Slf4j
@Component
public class ImageIoPluginRegistrar implements SmartLifecycle {

    static final String WEBP_READER_SPI = "com.luciad.imageio.webp.WebPImageReaderSpi";
    static final String WEBP_WRITER_SPI = "com.luciad.imageio.webp.WebPImageWriterSpi";

    /**
     * 由本类注册的 SPI 列表，用于停止时注销
     */
    private final List<IIOServiceProvider> registeredSpis = new ArrayList<>();

    private volatile boolean running;

    /**
     * 应用启动时调用
     * 扫描 classpath 上的 ImageIO 插件，WebP SPI 未被自动发现时手动注册
     */
    @Override
    public void start() {
        log.info("ImageIO 插件注册中...");
        ImageIO.scanForPlugins();

        if (!ImageIO.getImageReadersByFormatName("webp").hasNext()) {
            registerSpi(WEBP_READER_SPI, ImageReaderSpi.class);
        }
        if (!ImageIO.getImageWritersByFormatName("webp").hasNext()) {
            registerSpi(WEBP_WRITER_SPI, ImageWriterSpi.class);
        }

        log.info("可用的 ImageWriter 格式: {}", String.join(", ", ImageIO.getWriterFormatNames()));
        if (!ImageIO.getImageWritersByFormatName("webp").hasNext()) {
            log.warn("WebP ImageWriter 不可用！WebP 转换将失败，系统架构: {} {}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        }
        running = true;
    }

    /**
     * 应用停止时调用
     * 注销启动时注册的 SPI
     */
    @Override
    public void stop() {
        IIORegistry registry = IIORegistry.getDefaultInstance();
        for (IIOServiceProvider spi : registeredSpis) {
            try {
                registry.deregisterServiceProvider(spi);
                log.info("SPI 注销成功: {}", spi.getClass().getName());
            } catch (RuntimeException e) {
                log.warn("SPI 注销失败: {} - {}", spi.getClass().getName(), e.getMessage());
            }
        }
        registeredSpis.clear();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 已手动注册的 SPI 数量
     */
    int registeredCount() {
        return registeredSpis.size();
    }

    /**
     * 使用当前类加载器加载并注册 SPI
     * 类不存在时只记录警告，WebP 转换会在单个文件上失败
     */
    private <T extends IIOServiceProvider> void registerSpi(String className, Class<T> category) {
        try {
            Class<?> spiClass = getClass().getClassLoader().loadClass(className);
            T spi = category.cast(spiClass.getDeclaredConstructor().newInstance());
            IIORegistry.getDefaultInstance().registerServiceProvider(spi, category);
            registeredSpis.add(spi);
            log.info("{} 注册成功: {}", category.getSimpleName(), className);
        } catch (ReflectiveOperationException | LinkageError | ClassCastException e) {
            log.warn("{} 注册失败: {} - {}", category.getSimpleName(), className, e.toString());
        }
    }
}
