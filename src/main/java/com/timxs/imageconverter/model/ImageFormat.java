package com.timxs.imageconverter.model;

/**
 * 输出图片格式枚举
 * 定义用户可选的输出格式名称及其对应的编码器和扩展名
 */
public enum ImageFormat {

    /**
     * JPG（JPEG 编码器的别名，扩展名为 jpg）
     */
    JPG("JPEG", "jpg", true),

    /**
     * JPEG 格式（不支持透明度）
     */
    JPEG("JPEG", "jpeg", true),

    /**
     * PNG 格式（无损，支持透明度）
     */
    PNG("PNG", "png", false),

    /**
     * WebP 格式（有损/无损压缩，体积小）
     */
    WEBP("WEBP", "webp", false),

    /**
     * TIFF 格式
     */
    TIFF("TIFF", "tiff", false),

    /**
     * BMP 格式
     */
    BMP("BMP", "bmp", false);

    /**
     * 编码器标识
     */
    private final String codec;

    /**
     * 输出文件扩展名
     */
    private final String extension;

    /**
     * 是否要求不透明像素
     */
    private final boolean requiresOpaque;

    ImageFormat(String codec, String extension, boolean requiresOpaque) {
        this.codec = codec;
        this.extension = extension;
        this.requiresOpaque = requiresOpaque;
    }

    /**
     * 转换为解析后的格式描述
     *
     * @return 编码器、扩展名和不透明要求
     */
    public ResolvedFormat toResolved() {
        return new ResolvedFormat(codec, extension, requiresOpaque);
    }

    /**
     * 根据格式名称获取对应的格式（忽略大小写）
     *
     * @param name 格式名称，如 jpg、PNG
     * @return 对应的格式，未找到返回 null
     */
    public static ImageFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim();
        for (ImageFormat format : values()) {
            if (format.name().equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        return null;
    }
}
