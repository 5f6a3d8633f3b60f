package com.timxs.imageconverter.model;

/**
 * 解析后的输出格式
 *
 * @param codec          编码器标识（如 JPEG、PNG）
 * @param extension      输出文件扩展名（不带点号）
 * @param requiresOpaque 是否要求不透明像素（JPEG 不支持 Alpha 通道）
 */
public record ResolvedFormat(
    String codec,
    String extension,
    boolean requiresOpaque
) {
}
