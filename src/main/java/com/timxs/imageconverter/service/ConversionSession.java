package com.timxs.imageconverter.service;

import com.timxs.imageconverter.config.ConversionOptions;
import com.timxs.imageconverter.model.BatchEvent;
import com.timxs.imageconverter.model.BatchResult;
import com.timxs.imageconverter.model.MoveResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 转换会话接口
 * 前台入口：管理待转换队列和转换产物，发起批次转换和移动
 */
public interface ConversionSession {

    /**
     * 添加源文件，目录会递归查找支持的图片
     *
     * @param paths 文件或目录
     * @return 实际加入队列的数量
     */
    int addSources(Collection<Path> paths);

    /**
     * 按位置移除队列中的文件
     *
     * @param indices 位置
     */
    void removeSources(Set<Integer> indices);

    /**
     * 清空队列
     */
    void clearSources();

    /**
     * 当前队列
     *
     * @return 队列快照
     */
    List<Path> queued();

    /**
     * 发起批次转换
     * 上一批次的产物列表会被清空；事件会被缓存，晚订阅也能收到完整的事件序列
     *
     * @param options 转换参数
     * @return 批次事件流
     * @throws IllegalStateException 队列为空，或已有转换/移动在进行中
     * @throws com.timxs.imageconverter.exception.UnsupportedFormatException 格式不支持
     */
    Flux<BatchEvent> convert(ConversionOptions options);

    /**
     * 将最近一次转换的产物移动到目标目录
     *
     * @param destination 目标目录
     * @return 移动结果；转换进行中时返回 IllegalStateException 错误
     */
    Mono<MoveResult> moveConverted(Path destination);

    /**
     * 尚未移动的转换产物（只读视图）
     *
     * @return 产物路径
     */
    List<Path> converted();

    /**
     * 最近一次批次的结果
     *
     * @return 批次结果，还没有完成过批次时为 null
     */
    BatchResult lastResult();

    /**
     * 是否有转换或移动正在进行
     */
    boolean isBusy();
}
