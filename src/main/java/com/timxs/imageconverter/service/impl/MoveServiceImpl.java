package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.exception.DirectoryCreateFailedException;
import com.timxs.imageconverter.exception.MoveFailedException;
import com.timxs.imageconverter.service.MoveService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 移动服务实现
 * 目标目录已有同名文件时，使用 "{文件名} ({i}){扩展名}" 中最小的可用编号，
 * 每个文件都从 1 开始查找
 */
@Slf4j
@Service
public class MoveServiceImpl implements MoveService {

    @Override
    public int moveAll(List<Path> artifacts, Path destination) {
        try {
            Files.createDirectories(destination);
        } catch (IOException e) {
            // 目标目录不可用时整个移动失败，不移动任何文件
            throw new DirectoryCreateFailedException(destination, e);
        }

        int moved = 0;
        for (Path source : new ArrayList<>(artifacts)) {
            try {
                Path target = moveOne(source, destination);
                artifacts.remove(source);
                moved++;
                log.debug("移动成功: {} -> {}", source, target);
            } catch (MoveFailedException e) {
                log.warn("Move failed: {}", e.getMessage());
            }
        }
        log.info("Moved {} file(s) to: {}, {} remaining", moved, destination, artifacts.size());
        return moved;
    }

    /**
     * 移动单个文件
     * 优先直接移动（跨文件系统时由 Files.move 复制后删除），失败时再手动复制+删除
     */
    private Path moveOne(Path source, Path destination) {
        Path target = resolveTarget(destination, source.getFileName().toString());
        try {
            if (!Files.exists(source)) {
                throw new NoSuchFileException(source.toString());
            }
            Files.move(source, target);
            return target;
        } catch (IOException e) {
            if (Files.exists(source) && !Files.exists(target)) {
                return copyThenDelete(source, target, e);
            }
            throw new MoveFailedException(source, target, e);
        }
    }

    private Path copyThenDelete(Path source, Path target, IOException moveError) {
        try {
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            e.addSuppressed(moveError);
            throw new MoveFailedException(source, target, e);
        }
        try {
            Files.delete(source);
        } catch (IOException e) {
            // 源文件删不掉时撤销复制，保持只有一份
            try {
                Files.deleteIfExists(target);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new MoveFailedException(source, target, e);
        }
        return target;
    }

    /**
     * 计算不冲突的目标路径
     *
     * @param destination 目标目录
     * @param fileName    原文件名
     * @return 目标路径
     */
    static Path resolveTarget(Path destination, String fileName) {
        Path target = destination.resolve(fileName);
        if (!Files.exists(target)) {
            return target;
        }
        int lastDotIndex = fileName.lastIndexOf('.');
        String stem = lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
        String ext = lastDotIndex > 0 ? fileName.substring(lastDotIndex) : "";
        for (int i = 1; ; i++) {
            Path candidate = destination.resolve(stem + " (" + i + ")" + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }
}
