package com.timxs.imageconverter.model;

/**
 * 编码写入参数
 * 各编码器只读取自己用到的字段，其余字段忽略
 *
 * @param quality           输出质量（0-100，对 JPEG/WebP 有效）
 * @param optimize          是否优化编码（JPEG）
 * @param progressive       是否渐进式编码（JPEG）
 * @param lossless          是否无损模式（WebP）
 * @param compressionEffort 压缩等级（WebP method: 0-6），-1 表示使用编码器默认值
 * @param exif              原样写入的 EXIF 数据，为 null 表示不写
 */
public record WriteOptions(
    int quality,
    boolean optimize,
    boolean progressive,
    boolean lossless,
    int compressionEffort,
    byte[] exif
) {

    /**
     * WebP 最大压缩等级
     */
    public static final int MAX_WEBP_EFFORT = 6;

    /**
     * 编码器默认参数
     */
    public static WriteOptions defaults() {
        return new WriteOptions(-1, false, false, false, -1, null);
    }

    /**
     * JPEG 参数：指定质量，开启优化和渐进式编码
     */
    public static WriteOptions jpeg(int quality) {
        return new WriteOptions(quality, true, true, false, -1, null);
    }

    /**
     * WebP 参数：指定质量，最大压缩等级，关闭无损模式
     */
    public static WriteOptions webp(int quality) {
        return new WriteOptions(quality, false, false, false, MAX_WEBP_EFFORT, null);
    }

    /**
     * 返回附带 EXIF 数据的副本
     */
    public WriteOptions withExif(byte[] exifData) {
        return new WriteOptions(quality, optimize, progressive, lossless, compressionEffort, exifData);
    }

    public boolean hasQuality() {
        return quality >= 0;
    }

    public boolean hasExif() {
        return exif != null && exif.length > 0;
    }
}
