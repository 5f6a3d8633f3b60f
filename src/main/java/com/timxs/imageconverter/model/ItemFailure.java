package com.timxs.imageconverter.model;

import java.nio.file.Path;

/**
 * 单个文件的失败记录，仅用于诊断展示
 *
 * @param source  源文件
 * @param message 失败原因
 */
public record ItemFailure(
    Path source,
    String message
) {
}
