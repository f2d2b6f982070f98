package com.ocreval.core.engine;

import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.core.config.EngineCatalogProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 识别引擎工厂，根据名称选择对应的 Provider 并合并选项。
 * <p>
 * 选项优先级：Provider 默认值 &lt; {@code ocreval.engines.<name>} 配置 &lt; 调用方覆盖项。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecognitionEngineFactory {

    private final List<EngineProvider> providers;
    private final EngineCatalogProperties catalog;

    /**
     * 创建指定名称的引擎。
     *
     * @param engineName 引擎名称，{@code qwen_vl} 与 {@code qwen-vl} 等价
     * @param overrides  命令行传入的选项覆盖，可为空
     */
    public RecognitionEngine create(String engineName, Map<String, ?> overrides) {
        EngineProvider provider = findProvider(engineName);
        EngineOptions options = effectiveOptions(provider).merge(overrides);
        log.debug("创建引擎 {}，选项: {}", provider.engineName(), options);
        return provider.create(options);
    }

    /**
     * 未被调用方覆盖时的生效选项。
     */
    public EngineOptions effectiveOptions(String engineName) {
        return effectiveOptions(findProvider(engineName));
    }

    /**
     * 已注册的引擎名称，按字母排序。
     */
    public List<String> availableEngines() {
        return providers.stream().map(EngineProvider::engineName).sorted().toList();
    }

    public EngineProvider findProvider(String engineName) {
        String target = normalizeName(engineName);
        return providers.stream()
                .filter(p -> normalizeName(p.engineName()).equals(target))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "未知的识别引擎: " + engineName + "，可选: " + String.join(", ", availableEngines())));
    }

    private EngineOptions effectiveOptions(EngineProvider provider) {
        String target = normalizeName(provider.engineName());
        EngineOptions options = EngineOptions.of(provider.defaultOptions());
        for (Map.Entry<String, Map<String, Object>> entry : catalog.getEngines().entrySet()) {
            if (normalizeName(entry.getKey()).equals(target)) {
                options = options.merge(entry.getValue());
            }
        }
        return options;
    }

    public static String normalizeName(String engineName) {
        if (engineName == null || engineName.isBlank()) {
            throw new ConfigurationException("引擎名称不能为空");
        }
        return engineName.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
