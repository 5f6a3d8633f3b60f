package com.timxs.imageconverter.exception;

/**
 * 图片转换相关异常的基类
 */
public class ImageConverterException extends RuntimeException {

    public ImageConverterException(String message) {
        super(message);
    }

    public ImageConverterException(String message, Throwable cause) {
        super(message, cause);
    }
}
