package com.timxs.imageconverter.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 单个批次的转换参数（不可变）
 *
 * @param format       输出格式名称
 * @param quality      输出质量
 * @param keepMetadata 是否保留 EXIF
 * @param suffix       文件名后缀，可为空字符串
 * @param outputDir    输出目录
 */
public record ConversionOptions(
    String format,
    int quality,
    boolean keepMetadata,
    String suffix,
    Path outputDir
) {
    public ConversionOptions {
        suffix = suffix == null ? "" : suffix;
    }

    /**
     * 从 ConversionConfig 创建 ConversionOptions
     * 后缀会去掉首尾空白
     */
    public static ConversionOptions from(ConversionConfig config) {
        return new ConversionOptions(
            config.getFormat(),
            config.getQuality(),
            config.isKeepMetadata(),
            config.getSuffix() == null ? "" : config.getSuffix().strip(),
            Paths.get(config.getOutputDir())
        );
    }
}
