package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.config.ConversionOptions;
import com.timxs.imageconverter.model.BatchCompleted;
import com.timxs.imageconverter.model.BatchEvent;
import com.timxs.imageconverter.model.BatchResult;
import com.timxs.imageconverter.model.MoveResult;
import com.timxs.imageconverter.service.BatchWorker;
import com.timxs.imageconverter.service.ConversionQueue;
import com.timxs.imageconverter.service.ConversionSession;
import com.timxs.imageconverter.service.MoveService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * 转换会话实现
 * <p>
 * 产物列表只在两个时间段被修改：批次运行期间由 BatchWorker 追加，批次之间由 MoveService 移除。
 * busy 标志保证两者不会同时进行
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionSessionImpl implements ConversionSession {

    private final ConversionQueue conversionQueue;

    private final BatchWorker batchWorker;

    private final MoveService moveService;

    /**
     * 当前批次的转换产物，显示时可并发读取
     */
    private final List<Path> artifacts = new CopyOnWriteArrayList<>();

    /**
     * 是否有转换或移动正在进行
     */
    private final AtomicBoolean busy = new AtomicBoolean(false);

    private volatile BatchResult lastResult;

    @Override
    public int addSources(Collection<Path> paths) {
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                files.addAll(findImages(path));
            } else {
                files.add(path);
            }
        }
        int added = conversionQueue.add(files);
        log.info("Added {} file(s). Total in queue: {}.", added, conversionQueue.size());
        return added;
    }

    /**
     * 递归查找目录中支持的图片
     */
    private List<Path> findImages(Path directory) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream
                .filter(ConversionQueueImpl::hasSupportedExtension)
                .filter(Files::isRegularFile)
                .sorted()
                .toList();
        } catch (IOException | RuntimeException e) {
            log.warn("扫描目录失败: {} - {}", directory, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void removeSources(Set<Integer> indices) {
        conversionQueue.remove(indices);
    }

    @Override
    public void clearSources() {
        conversionQueue.clear();
        log.info("Cleared list.");
    }

    @Override
    public List<Path> queued() {
        return conversionQueue.list();
    }

    @Override
    public Flux<BatchEvent> convert(ConversionOptions options) {
        if (conversionQueue.isEmpty()) {
            throw new IllegalStateException("队列为空，请先添加图片");
        }
        if (!busy.compareAndSet(false, true)) {
            throw new IllegalStateException("转换或移动正在进行中");
        }

        Flux<BatchEvent> events;
        try {
            events = batchWorker.run(conversionQueue.list(), options, artifacts);
        } catch (RuntimeException e) {
            busy.set(false);
            throw e;
        }
        // 新批次开始，旧产物不再跟踪（文件保留在磁盘上）
        artifacts.clear();

        Sinks.Many<BatchEvent> sink = Sinks.many().replay().all();
        events
            .doOnNext(event -> {
                if (event instanceof BatchCompleted completed) {
                    lastResult = completed.result();
                    // 先释放再通知订阅者，完成回调里可以直接发起移动
                    busy.set(false);
                }
            })
            .subscribe(
                sink::tryEmitNext,
                error -> {
                    log.error("批次转换异常终止", error);
                    busy.set(false);
                    sink.tryEmitError(error);
                },
                sink::tryEmitComplete
            );
        return sink.asFlux();
    }

    @Override
    public Mono<MoveResult> moveConverted(Path destination) {
        return Mono.defer(() -> {
            if (!busy.compareAndSet(false, true)) {
                return Mono.error(new IllegalStateException("转换正在进行中，请完成后再移动"));
            }
            if (artifacts.isEmpty()) {
                busy.set(false);
                log.info("Nothing to move, convert some files first.");
                return Mono.just(new MoveResult(0, 0, destination));
            }
            return Mono.fromCallable(() -> {
                    int moved = moveService.moveAll(artifacts, destination);
                    return new MoveResult(moved, artifacts.size(), destination);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> busy.set(false));
        });
    }

    @Override
    public List<Path> converted() {
        return Collections.unmodifiableList(artifacts);
    }

    @Override
    public BatchResult lastResult() {
        return lastResult;
    }

    @Override
    public boolean isBusy() {
        return busy.get();
    }
}
