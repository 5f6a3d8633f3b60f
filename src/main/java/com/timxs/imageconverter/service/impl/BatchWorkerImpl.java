package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.config.ConversionOptions;
import com.timxs.imageconverter.model.BatchCompleted;
import com.timxs.imageconverter.model.BatchEvent;
import com.timxs.imageconverter.model.BatchProgress;
import com.timxs.imageconverter.model.BatchResult;
import com.timxs.imageconverter.model.ItemFailure;
import com.timxs.imageconverter.model.ItemStatus;
import com.timxs.imageconverter.model.ResolvedFormat;
import com.timxs.imageconverter.service.BatchWorker;
import com.timxs.imageconverter.service.FormatResolver;
import com.timxs.imageconverter.service.ImageExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 批次转换执行器实现
 * 在弹性线程池中按队列顺序逐个转换，不做并行；每个文件处理完发出进度事件，
 * 全部处理完发出一次完成事件
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchWorkerImpl implements BatchWorker {

    private final FormatResolver formatResolver;

    private final ImageExporter imageExporter;

    @Override
    public Flux<BatchEvent> run(List<Path> snapshot, ConversionOptions options, List<Path> artifacts) {
        // 批次开始前解析格式，不支持的格式直接抛给调用方
        ResolvedFormat format = formatResolver.resolve(options.format());
        List<Path> sources = List.copyOf(snapshot);

        return Flux.defer(() -> {
                BatchCounter counter = new BatchCounter(sources.size());
                log.info("开始转换 {} 个文件 -> {} ({}), 输出目录: {}",
                    sources.size(), options.format(), format.codec(), options.outputDir());

                return Flux.fromIterable(sources)
                    .concatMap(source -> Mono.fromCallable(
                        () -> convertOne(source, format, options, artifacts, counter)))
                    .concatWith(Mono.fromCallable(() -> complete(counter, options)));
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<BatchResult> execute(List<Path> snapshot, ConversionOptions options, List<Path> artifacts) {
        return run(snapshot, options, artifacts)
            .ofType(BatchCompleted.class)
            .single()
            .map(BatchCompleted::result);
    }

    /**
     * 转换单个文件
     * 失败只计数，不抛出
     */
    private BatchEvent convertOne(Path source, ResolvedFormat format, ConversionOptions options,
                                  List<Path> artifacts, BatchCounter counter) {
        Path output = null;
        ItemStatus status;
        try {
            output = imageExporter.export(source, options.outputDir(), format, options.quality(),
                options.keepMetadata(), options.suffix());
            artifacts.add(output);
            counter.successes.incrementAndGet();
            status = ItemStatus.SUCCESS;
        } catch (Throwable t) {
            // 捕获所有异常包括 Error（如 WebP native 库加载失败），确保单个文件不会中断批次
            log.warn("转换失败: {} - {}", source, t.getMessage());
            log.debug("转换失败详情: {}", source, t);
            counter.fail(source, t);
            status = ItemStatus.FAILED;
        }
        int processed = counter.processed.incrementAndGet();
        return new BatchProgress(processed, counter.total, source, status, output);
    }

    private BatchEvent complete(BatchCounter counter, ConversionOptions options) {
        BatchResult result = new BatchResult(counter.successes.get(), counter.failures.get(),
            options.outputDir(), counter.failedItems);
        log.info("转换完成: 成功 {} 个, 失败 {} 个, 输出目录: {}",
            result.successes(), result.failures(), result.outputDir());
        return new BatchCompleted(result);
    }

    /**
     * 单次批次运行的计数器，每次订阅新建
     */
    private static final class BatchCounter {

        private final int total;
        private final AtomicInteger processed = new AtomicInteger(0);
        private final AtomicInteger successes = new AtomicInteger(0);
        private final AtomicInteger failures = new AtomicInteger(0);
        private final List<ItemFailure> failedItems = Collections.synchronizedList(new ArrayList<>());

        private BatchCounter(int total) {
            this.total = total;
        }

        private void fail(Path source, Throwable t) {
            failures.incrementAndGet();
            String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
            failedItems.add(new ItemFailure(source, message));
        }
    }
}
