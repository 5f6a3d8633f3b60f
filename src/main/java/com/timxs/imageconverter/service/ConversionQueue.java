package com.timxs.imageconverter.service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 待转换队列接口
 * 有序且按规范路径去重
 */
public interface ConversionQueue {

    /**
     * 添加源文件
     * 非普通文件、不支持的扩展名以及重复路径会被静默跳过
     *
     * @param paths 源文件路径
     * @return 实际添加的数量
     */
    int add(Collection<Path> paths);

    /**
     * 按位置移除，不存在的位置忽略
     *
     * @param indices 要移除的位置
     */
    void remove(Set<Integer> indices);

    /**
     * 清空队列
     */
    void clear();

    /**
     * 获取队列快照（按添加顺序）
     *
     * @return 不可变列表
     */
    List<Path> list();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
