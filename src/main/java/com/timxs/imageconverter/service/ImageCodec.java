package com.timxs.imageconverter.service;

import com.timxs.imageconverter.model.DecodedImage;
import com.timxs.imageconverter.model.WriteOptions;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 图片编解码接口
 * 负责把文件解码为像素数据，以及按指定编码器写出
 */
public interface ImageCodec {

    /**
     * 打开并解码图片
     *
     * @param path 图片文件
     * @return 解码后的图片（包含 EXIF，如果有）
     * @throws IOException 文件无法读取或格式无法解码
     */
    DecodedImage open(Path path) throws IOException;

    /**
     * 按指定编码器写出图片
     * <p>
     * EXIF 只写入 JPEG（APP1）和 PNG（eXIf），其他编码器忽略 {@link WriteOptions#exif()}
     *
     * @param image   图片
     * @param path    输出文件
     * @param codec   编码器标识（如 JPEG、PNG）
     * @param options 写入参数
     * @throws IOException 编码或写入失败
     */
    void save(DecodedImage image, Path path, String codec, WriteOptions options) throws IOException;

    /**
     * 检查编码器能否直接写出该像素类型
     *
     * @param image 像素数据
     * @param codec 编码器标识
     * @return 是否可以写出
     */
    boolean canEncode(BufferedImage image, String codec);
}
