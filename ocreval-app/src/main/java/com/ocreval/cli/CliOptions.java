package com.ocreval.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocreval.common.exception.ConfigurationException;
import org.springframework.boot.ApplicationArguments;

import java.util.List;
import java.util.Map;

/**
 * 读取 {@code --name=value} 形式的选项。
 */
final class CliOptions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CliOptions() {
    }

    /**
     * 选项值，重复出现时取最后一个，未给出或为空时返回默认值。
     */
    static String value(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    /**
     * 解析 {@code --model-config} 的 JSON 值，未给出时返回空 Map。
     */
    static <T> Map<String, T> modelConfig(String json, TypeReference<Map<String, T>> type) {
        if (json == null) {
            return Map.of();
        }
        try {
            Map<String, T> parsed = MAPPER.readValue(json, type);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("模型配置 JSON 格式错误: " + e.getOriginalMessage(), e);
        }
    }
}
