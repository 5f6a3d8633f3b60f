package com.timxs.imageconverter.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 单个文件转换失败（解码、编码或 IO 错误）
 */
@Getter
public class ExportFailedException extends ImageConverterException {

    /**
     * 转换失败的源文件
     */
    private final Path source;

    public ExportFailedException(Path source, Throwable cause) {
        super("Failed to export " + source + ": " + describe(cause), cause);
        this.source = source;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
