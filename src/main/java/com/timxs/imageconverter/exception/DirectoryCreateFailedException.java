package com.timxs.imageconverter.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 目录创建失败，导致请求它的整个操作失败（导出或移动）
 */
@Getter
public class DirectoryCreateFailedException extends ImageConverterException {

    /**
     * 无法创建的目录
     */
    private final Path directory;

    public DirectoryCreateFailedException(Path directory, Throwable cause) {
        super("Cannot create directory " + directory + ": " + cause, cause);
        this.directory = directory;
    }
}
