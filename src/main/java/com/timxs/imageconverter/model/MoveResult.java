package com.timxs.imageconverter.model;

import java.nio.file.Path;

/**
 * 移动结果
 *
 * @param moved       成功移动的数量
 * @param remaining   仍留在待移动列表中的数量（可重试）
 * @param destination 目标目录
 */
public record MoveResult(
    int moved,
    int remaining,
    Path destination
) {
}
