package com.timxs.imageconverter.service;

import com.timxs.imageconverter.model.ResolvedFormat;

import java.util.List;

/**
 * 格式解析器接口
 * 将用户选择的输出格式名称映射为编码器、扩展名和格式标志
 */
public interface FormatResolver {

    /**
     * 解析输出格式（忽略大小写）
     *
     * @param name 格式名称，如 JPG、png
     * @return 解析后的格式
     * @throws com.timxs.imageconverter.exception.UnsupportedFormatException 无法识别的格式名称
     */
    ResolvedFormat resolve(String name);

    /**
     * 获取支持的输出格式名称（按显示顺序）
     *
     * @return 格式名称列表
     */
    List<String> supportedNames();
}
