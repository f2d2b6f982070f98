package com.ocreval.core.engine;

import com.ocreval.common.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 引擎选项：名称 -> 值的不可变映射，附带类型转换。
 * <p>
 * 选项名不区分大小写，{@code _} 与 {@code -} 等价，
 * {@code model_name} 与 {@code MODEL-NAME} 都会归一为 {@code model-name}。
 */
public final class EngineOptions {

    private static final EngineOptions EMPTY = new EngineOptions(Map.of());

    private final Map<String, Object> values;

    private EngineOptions(Map<String, Object> values) {
        this.values = values;
    }

    public static EngineOptions empty() {
        return EMPTY;
    }

    public static EngineOptions of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        raw.forEach((key, value) -> normalized.put(normalizeKey(key), value));
        return new EngineOptions(Collections.unmodifiableMap(normalized));
    }

    /**
     * 以 overrides 覆盖当前选项，返回新的选项对象；值为 null 的覆盖项会被忽略。
     */
    public EngineOptions merge(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        overrides.forEach((key, value) -> {
            if (value != null) {
                merged.put(normalizeKey(key), value);
            }
        });
        return new EngineOptions(Collections.unmodifiableMap(merged));
    }

    public boolean contains(String key) {
        return values.containsKey(normalizeKey(key));
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(normalizeKey(key));
        return value == null ? defaultValue : value.toString();
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(normalizeKey(key));
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("引擎选项 " + key + " 不是整数: " + value, e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(normalizeKey(key));
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("引擎选项 " + key + " 不是数字: " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(normalizeKey(key));
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigurationException("引擎选项 " + key + " 不是布尔值: " + value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
