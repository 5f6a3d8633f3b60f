package com.timxs.imageconverter.service;

import com.timxs.imageconverter.model.ResolvedFormat;

import java.nio.file.Path;

/**
 * 图片导出器接口
 * 将一个源图片转换为一个输出文件，负责各编码器的特殊处理
 */
public interface ImageExporter {

    /**
     * 导出单个图片
     *
     * @param source       源文件
     * @param outputDir    输出目录（不存在时自动创建）
     * @param format       解析后的目标格式
     * @param quality      输出质量
     * @param keepMetadata 是否保留 EXIF
     * @param suffix       文件名后缀
     * @return 输出文件路径
     * @throws com.timxs.imageconverter.exception.ExportFailedException          解码、编码或 IO 错误
     * @throws com.timxs.imageconverter.exception.DirectoryCreateFailedException 输出目录无法创建
     */
    Path export(Path source, Path outputDir, ResolvedFormat format, int quality,
                boolean keepMetadata, String suffix);
}
