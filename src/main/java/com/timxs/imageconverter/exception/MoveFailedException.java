package com.timxs.imageconverter.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 单个文件移动失败，文件保留在待移动列表中
 */
@Getter
public class MoveFailedException extends ImageConverterException {

    private final Path source;

    private final Path target;

    public MoveFailedException(Path source, Path target, Throwable cause) {
        super("Failed to move " + source + " to " + target + ": " + cause, cause);
        this.source = source;
        this.target = target;
    }
}
