package com.timxs.imageconverter.model;

/**
 * 单个文件的转换状态
 */
public enum ItemStatus {
    /**
     * 转换成功
     */
    SUCCESS,

    /**
     * 转换失败（已计数，批次继续）
     */
    FAILED
}
