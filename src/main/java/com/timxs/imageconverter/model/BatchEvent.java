package com.timxs.imageconverter.model;

/**
 * 批次事件
 * 一个批次依次发出每个文件的 {@link BatchProgress}，最后发出一次 {@link BatchCompleted}
 */
public interface BatchEvent {

    /**
     * 是否为完成事件
     */
    default boolean isCompletion() {
        return false;
    }
}
