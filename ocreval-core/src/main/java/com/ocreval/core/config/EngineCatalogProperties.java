package com.ocreval.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 各识别引擎的配置，{@code ocreval.engines.<引擎名>.<选项>}。
 * <p>
 * 选项内容对评估核心不透明，原样交给对应的 {@link com.ocreval.core.engine.EngineProvider}。
 */
@Data
@ConfigurationProperties(prefix = "ocreval")
public class EngineCatalogProperties {

    private Map<String, Map<String, Object>> engines = new LinkedHashMap<>();
}
