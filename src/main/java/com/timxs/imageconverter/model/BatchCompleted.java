package com.timxs.imageconverter.model;

/**
 * 完成事件，每个批次只发出一次
 *
 * @param result 批次结果
 */
public record BatchCompleted(BatchResult result) implements BatchEvent {

    @Override
    public boolean isCompletion() {
        return true;
    }
}
