package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.exception.UnsupportedFormatException;
import com.timxs.imageconverter.model.ImageFormat;
import com.timxs.imageconverter.model.ResolvedFormat;
import com.timxs.imageconverter.service.FormatResolver;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * 格式解析器实现
 * JPG 和 JPEG 都使用 JPEG 编码器，仅扩展名不同
 */
@Service
public class FormatResolverImpl implements FormatResolver {

    private static final List<String> SUPPORTED_NAMES = Arrays.stream(ImageFormat.values())
        .map(Enum::name)
        .toList();

    @Override
    public ResolvedFormat resolve(String name) {
        ImageFormat format = ImageFormat.fromName(name);
        if (format == null) {
            throw new UnsupportedFormatException(name);
        }
        return format.toResolved();
    }

    @Override
    public List<String> supportedNames() {
        return SUPPORTED_NAMES;
    }
}
