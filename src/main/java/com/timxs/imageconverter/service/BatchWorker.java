package com.timxs.imageconverter.service;

import com.timxs.imageconverter.config.ConversionOptions;
import com.timxs.imageconverter.model.BatchEvent;
import com.timxs.imageconverter.model.BatchResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * 批次转换执行器接口
 * 在后台线程中按顺序转换队列快照，单个文件失败不会中断批次
 * <p>
 * 前置条件：同一个队列和产物列表上不能同时运行两个批次，由调用方保证
 */
public interface BatchWorker {

    /**
     * 执行批次转换
     * 格式在返回前同步解析，不支持的格式直接抛出异常
     * 返回的 Flux 为冷流，每次订阅执行一次批次：每个文件发出一个进度事件，最后发出一个完成事件
     *
     * @param snapshot  队列快照
     * @param options   转换参数
     * @param artifacts 产物列表，成功的输出路径按顺序追加
     * @return 批次事件流
     * @throws com.timxs.imageconverter.exception.UnsupportedFormatException 格式不支持
     */
    Flux<BatchEvent> run(List<Path> snapshot, ConversionOptions options, List<Path> artifacts);

    /**
     * 执行批次转换并只返回最终结果
     *
     * @param snapshot  队列快照
     * @param options   转换参数
     * @param artifacts 产物列表
     * @return 批次结果
     */
    Mono<BatchResult> execute(List<Path> snapshot, ConversionOptions options, List<Path> artifacts);
}
