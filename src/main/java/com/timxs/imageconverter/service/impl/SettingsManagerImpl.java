package com.timxs.imageconverter.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timxs.imageconverter.config.ConversionConfig;
import com.timxs.imageconverter.service.SettingsManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 配置管理器实现
 * 从 JSON 配置文件读取配置，转换为 ConversionConfig 对象
 * <p>
 * 查找顺序：系统属性 image-converter.config 指定的文件 -> 工作目录下的 image-converter.json
 * -> classpath 中的 image-converter.json -> 默认值
 */
@Slf4j
@Service
public class SettingsManagerImpl implements SettingsManager {

    /**
     * 指定配置文件的系统属性
     */
    public static final String CONFIG_PROPERTY = "image-converter.config";

    /**
     * 默认配置文件名
     */
    public static final String DEFAULT_CONFIG_NAME = "image-converter.json";

    /**
     * 界面可选的质量范围
     */
    private static final int MIN_QUALITY = 50;
    private static final int MAX_QUALITY = 100;

    /**
     * JSON 解析器
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public Mono<ConversionConfig> getConfig() {
        String configured = System.getProperty(CONFIG_PROPERTY);
        Path settingsFile = Paths.get(configured != null && !configured.isBlank() ? configured : DEFAULT_CONFIG_NAME);
        return getConfig(settingsFile);
    }

    @Override
    public Mono<ConversionConfig> getConfig(Path settingsFile) {
        return Mono.fromCallable(() -> buildConfig(readSettings(settingsFile)))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.warn("Failed to load settings from {}, using defaults: {}", settingsFile, e.getMessage());
                return Mono.just(new ConversionConfig());
            });
    }

    /**
     * 读取配置 JSON
     * 指定文件不存在时尝试 classpath 中的默认配置
     */
    private JsonNode readSettings(Path settingsFile) throws IOException {
        if (settingsFile != null && Files.isRegularFile(settingsFile)) {
            log.debug("读取配置文件: {}", settingsFile.toAbsolutePath());
            try (InputStream in = Files.newInputStream(settingsFile)) {
                return OBJECT_MAPPER.readTree(in);
            }
        }
        try (InputStream in = SettingsManagerImpl.class.getResourceAsStream("/" + DEFAULT_CONFIG_NAME)) {
            if (in == null) {
                log.debug("没有找到配置文件，使用默认配置");
                return OBJECT_MAPPER.createObjectNode();
            }
            log.debug("读取内置配置: {}", DEFAULT_CONFIG_NAME);
            return OBJECT_MAPPER.readTree(in);
        }
    }

    /**
     * 构建配置对象
     * 读取 conversion 和 move 两组设置，缺失的项使用默认值
     */
    private ConversionConfig buildConfig(JsonNode setting) {
        ConversionConfig config = new ConversionConfig();
        if (setting == null || setting.isMissingNode() || setting.isNull()) {
            return config;
        }

        JsonNode conversion = setting.get("conversion");
        if (conversion != null) {
            config.setFormat(getString(conversion, "format", config.getFormat()));
            config.setQuality(getInt(conversion, "quality", config.getQuality()));
            config.setKeepMetadata(getBoolean(conversion, "keepMetadata", config.isKeepMetadata()));
            config.setSuffix(getString(conversion, "suffix", config.getSuffix()));
            config.setOutputDir(getString(conversion, "outputDir", config.getOutputDir()));
        }

        JsonNode move = setting.get("move");
        if (move != null) {
            config.setMoveDestination(getString(move, "destination", config.getMoveDestination()));
        }

        // 超出界面范围的质量值仍然接受，只提示
        if (config.getQuality() < MIN_QUALITY || config.getQuality() > MAX_QUALITY) {
            log.warn("Quality {} is outside the usual range {}-{}", config.getQuality(), MIN_QUALITY, MAX_QUALITY);
        }
        log.debug("转换配置 - format: {}, quality: {}, keepMetadata: {}, suffix: '{}', outputDir: {}",
            config.getFormat(), config.getQuality(), config.isKeepMetadata(),
            config.getSuffix(), config.getOutputDir());
        return config;
    }

    // ========== JsonNode 辅助方法 ==========

    /**
     * 从 JsonNode 获取布尔值
     */
    private boolean getBoolean(JsonNode node, String key, boolean defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isBoolean()) {
            return value.asBoolean();
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取整数值
     * 支持数字类型和字符串类型
     */
    private int getInt(JsonNode node, String key, int defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asInt();
            }
            if (value.isTextual()) {
                try {
                    return Integer.parseInt(value.asText().trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取字符串值
     */
    private String getString(JsonNode node, String key, String defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        return defaultValue;
    }
}
