package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.service.ConversionQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 待转换队列实现
 * 以规范路径（绝对路径、解析符号链接）判断重复，所有操作加锁，
 * 前台可以在批次运行时读取队列
 */
@Slf4j
@Service
public class ConversionQueueImpl implements ConversionQueue {

    /**
     * 支持的输入扩展名（小写，不带点号）
     */
    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
        "webp", "png", "jpg", "jpeg", "bmp", "tif", "tiff", "gif", "heic"
    );

    private final List<Path> entries = new ArrayList<>();

    /**
     * 与 entries 一一对应的规范路径
     */
    private final List<Path> canonicalEntries = new ArrayList<>();

    private final Set<Path> canonicalPaths = new HashSet<>();

    @Override
    public synchronized int add(Collection<Path> paths) {
        if (paths == null || paths.isEmpty()) {
            return 0;
        }
        int added = 0;
        for (Path path : paths) {
            if (path == null || !isSupportedImage(path)) {
                log.debug("跳过不支持的文件: {}", path);
                continue;
            }
            Path canonical = canonicalize(path);
            if (canonicalPaths.add(canonical)) {
                entries.add(path);
                canonicalEntries.add(canonical);
                added++;
            } else {
                log.debug("跳过重复文件: {}", path);
            }
        }
        log.debug("Added {} file(s), total in queue: {}", added, entries.size());
        return added;
    }

    @Override
    public synchronized void remove(Set<Integer> indices) {
        if (indices == null || indices.isEmpty()) {
            return;
        }
        // 从后往前删除，避免位置偏移
        TreeSet<Integer> ordered = new TreeSet<>();
        indices.stream().filter(Objects::nonNull).forEach(ordered::add);
        for (Integer index : ordered.descendingSet()) {
            if (index < 0 || index >= entries.size()) {
                continue;
            }
            entries.remove(index.intValue());
            canonicalPaths.remove(canonicalEntries.remove(index.intValue()));
        }
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        canonicalEntries.clear();
        canonicalPaths.clear();
    }

    @Override
    public synchronized List<Path> list() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    /**
     * 是否为支持的图片文件（普通文件且扩展名在支持列表中）
     */
    public static boolean isSupportedImage(Path path) {
        return hasSupportedExtension(path) && Files.isRegularFile(path);
    }

    /**
     * 扩展名是否在支持列表中（忽略大小写）
     */
    public static boolean hasSupportedExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int lastDotIndex = name.lastIndexOf('.');
        if (lastDotIndex < 0 || lastDotIndex == name.length() - 1) {
            return false;
        }
        return SUPPORTED_EXTENSIONS.contains(name.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * 计算规范路径
     * 文件无法解析时（如已被删除）退化为绝对路径
     */
    private static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
