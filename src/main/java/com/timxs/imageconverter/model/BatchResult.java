package com.timxs.imageconverter.model;

import java.nio.file.Path;
import java.util.List;

/**
 * 批次转换结果
 *
 * @param successes 成功数量
 * @param failures  失败数量
 * @param outputDir 输出目录
 * @param failedItems 失败明细
 */
public record BatchResult(
    int successes,
    int failures,
    Path outputDir,
    List<ItemFailure> failedItems
) {
    public BatchResult {
        failedItems = failedItems == null ? List.of() : List.copyOf(failedItems);
    }

    public int total() {
        return successes + failures;
    }

    public boolean hasFailures() {
        return failures > 0;
    }
}
