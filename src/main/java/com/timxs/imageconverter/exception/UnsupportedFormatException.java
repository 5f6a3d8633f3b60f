package com.timxs.imageconverter.exception;

import lombok.Getter;

/**
 * 不支持的输出格式，批次开始前抛出
 */
@Getter
public class UnsupportedFormatException extends ImageConverterException {

    /**
     * 用户请求的格式名称
     */
    private final String formatName;

    public UnsupportedFormatException(String formatName) {
        super("Unsupported output format: " + formatName);
        this.formatName = formatName;
    }
}
