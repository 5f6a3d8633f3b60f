package com.timxs.imageconverter.service;

import java.nio.file.Path;
import java.util.List;

/**
 * 移动服务接口
 * 将转换产物移动到目标目录，同名文件自动编号，不会覆盖已有文件
 */
public interface MoveService {

    /**
     * 移动全部产物
     * 移动成功的条目会从列表中移除，失败的保留以便重试
     *
     * @param artifacts   产物列表（会被修改）
     * @param destination 目标目录
     * @return 成功移动的数量
     * @throws com.timxs.imageconverter.exception.DirectoryCreateFailedException 目标目录无法创建
     */
    int moveAll(List<Path> artifacts, Path destination);
}
