package com.timxs.imageconverter.model;

import java.nio.file.Path;

/**
 * 进度事件，每处理完一个文件发出一次
 *
 * @param processed 已处理数量（含失败）
 * @param total     批次总数
 * @param source    当前源文件
 * @param status    当前文件的转换状态
 * @param output    输出文件，失败时为 null
 */
public record BatchProgress(
    int processed,
    int total,
    Path source,
    ItemStatus status,
    Path output
) implements BatchEvent {
}
