package com.timxs.imageconverter.model;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;

/**
 * 解码后的图片
 *
 * @param pixels       像素数据
 * @param sourceFormat 源文件的格式名称（如 png、jpeg）
 * @param exif         源文件携带的 EXIF 数据，没有则为 null
 */
public record DecodedImage(
    BufferedImage pixels,
    String sourceFormat,
    byte[] exif
) {

    /**
     * 是否带 Alpha 通道或带透明色的调色板
     */
    public boolean hasTransparency() {
        return pixels.getColorModel().hasAlpha();
    }

    /**
     * 是否为调色板（索引色）图片
     */
    public boolean isIndexed() {
        return pixels.getColorModel() instanceof IndexColorModel;
    }

    public boolean hasExif() {
        return exif != null && exif.length > 0;
    }

    /**
     * 替换像素数据，保留其余信息
     */
    public DecodedImage withPixels(BufferedImage newPixels) {
        return new DecodedImage(newPixels, sourceFormat, exif);
    }
}
