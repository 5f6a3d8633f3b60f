package com.timxs.imageconverter.config;

import lombok.Data;

/**
 * 图片转换配置
 * 包含输出格式、质量、元数据、文件名和目录设置
 */
@Data
public class ConversionConfig {

    // ========== 格式设置 ==========

    /**
     * 输出格式名称（JPG / JPEG / PNG / WEBP / TIFF / BMP）
     */
    private String format = "JPG";

    /**
     * 输出质量（界面范围 50-100，仅对 JPEG 和 WebP 有效）
     */
    private int quality = 90;

    /**
     * 是否尽量保留 EXIF 元数据
     */
    private boolean keepMetadata = true;

    // ========== 输出设置 ==========

    /**
     * 输出文件名后缀（可为空）
     */
    private String suffix = "_converted";

    /**
     * 输出目录
     */
    private String outputDir = "converted_output";

    // ========== 移动设置 ==========

    /**
     * 转换完成后移动到的目录（为空则不移动）
     */
    private String moveDestination = "";
}
