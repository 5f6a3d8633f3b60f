package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.exception.DirectoryCreateFailedException;
import com.timxs.imageconverter.exception.ExportFailedException;
import com.timxs.imageconverter.model.DecodedImage;
import com.timxs.imageconverter.model.ResolvedFormat;
import com.timxs.imageconverter.model.WriteOptions;
import com.timxs.imageconverter.service.ImageCodec;
import com.timxs.imageconverter.service.ImageExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 图片导出器实现
 * 处理顺序：创建输出目录 -> 解码 -> 像素转换 -> 构建编码参数 -> 写出
 * <p>
 * 输出文件名为 {源文件名}{后缀}.{扩展名}，不做重名检查，
 * 同一目录下同名同后缀的输出会被后一次导出覆盖
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageExporterImpl implements ImageExporter {

    /**
     * 编解码器
     */
    private final ImageCodec imageCodec;

    @Override
    public Path export(Path source, Path outputDir, ResolvedFormat format, int quality,
                       boolean keepMetadata, String suffix) {
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(outputFileName(source, suffix, format.extension()));

        try {
            DecodedImage image = imageCodec.open(source);
            DecodedImage prepared = preparePixels(image, format);

            WriteOptions options = buildWriteOptions(format, quality);
            if (keepMetadata && image.hasExif()) {
                options = options.withExif(image.exif());
                log.debug("保留 EXIF: {} ({} bytes)", source.getFileName(), image.exif().length);
            }

            imageCodec.save(prepared, outputPath, format.codec(), options);
        } catch (IOException | RuntimeException e) {
            throw new ExportFailedException(source, e);
        }

        log.debug("导出成功: {} -> {}", source.getFileName(), outputPath);
        return outputPath;
    }

    /**
     * 创建输出目录（递归）
     */
    private void ensureDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new DirectoryCreateFailedException(outputDir, e);
        }
    }

    /**
     * 计算输出文件名
     * 去掉源文件最后一个扩展名，拼接后缀和新扩展名
     */
    static String outputFileName(Path source, String suffix, String extension) {
        String name = source.getFileName().toString();
        int lastDotIndex = name.lastIndexOf('.');
        String stem = lastDotIndex > 0 ? name.substring(0, lastDotIndex) : name;
        return stem + (suffix == null ? "" : suffix) + "." + extension;
    }

    /**
     * 按目标格式转换像素
     * <ul>
     *   <li>JPEG：带透明度的图片合成到白色背景，统一转换为 RGB</li>
     *   <li>PNG：调色板图片转换为 ARGB，保留透明度</li>
     *   <li>其他：保持原样；编码器无法写出当前像素类型时（如 BMP 不支持 Alpha）再做转换</li>
     * </ul>
     */
    private DecodedImage preparePixels(DecodedImage image, ResolvedFormat format) {
        BufferedImage pixels = image.pixels();

        if (format.requiresOpaque()) {
            if (image.hasTransparency()) {
                log.debug("{} 不支持透明度，合成到白色背景", format.codec());
            }
            return image.withPixels(convertToRGB(pixels));
        }

        if ("PNG".equals(format.codec()) && image.isIndexed()) {
            return image.withPixels(convertToARGB(pixels));
        }

        if (!imageCodec.canEncode(pixels, format.codec())) {
            if (image.hasTransparency()) {
                BufferedImage argb = convertToARGB(pixels);
                if (imageCodec.canEncode(argb, format.codec())) {
                    return image.withPixels(argb);
                }
                log.debug("{} 无法写出带 Alpha 的图片，合成到白色背景", format.codec());
            }
            return image.withPixels(convertToRGB(pixels));
        }
        return image;
    }

    /**
     * 根据编码器构建写入参数
     * JPEG：质量 + 优化 + 渐进式；WebP：质量 + 最大压缩等级 + 有损模式；其他格式不需要额外参数
     */
    private WriteOptions buildWriteOptions(ResolvedFormat format, int quality) {
        return switch (format.codec()) {
            case "JPEG" -> WriteOptions.jpeg(quality);
            case "WEBP" -> WriteOptions.webp(quality);
            default -> WriteOptions.defaults();
        };
    }

    /**
     * 将任意类型的 BufferedImage 转换为 TYPE_INT_RGB
     * 透明区域填充为白色
     *
     * @param src 源图片
     * @return RGB 格式的图片
     */
    private BufferedImage convertToRGB(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            // 直接绘制源图像，Java 2D 会自动处理 Alpha 合成
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * 将图片转换为 TYPE_INT_ARGB，保留透明度
     */
    private BufferedImage convertToARGB(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_ARGB) {
            return src;
        }
        BufferedImage argb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }
}
