package com.timxs.imageconverter.service;

import com.timxs.imageconverter.config.ConversionConfig;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 配置管理器接口
 * 从 JSON 配置文件中读取转换配置
 */
public interface SettingsManager {

    /**
     * 获取当前配置（默认配置文件）
     *
     * @return 转换配置
     */
    Mono<ConversionConfig> getConfig();

    /**
     * 从指定文件读取配置
     *
     * @param settingsFile 配置文件
     * @return 转换配置，读取失败时返回默认配置
     */
    Mono<ConversionConfig> getConfig(Path settingsFile);
}
