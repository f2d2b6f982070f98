package com.ocreval.engine.vision;

import com.ocreval.core.engine.EngineOptions;
import com.ocreval.core.engine.EngineProvider;
import com.ocreval.core.engine.RecognitionEngine;
import com.ocreval.engine.prompt.PromptTemplates;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Qwen2.5-VL 等多模态模型（默认通过 LM Studio 的 OpenAI 兼容接口访问）。
 */
@Component
@RequiredArgsConstructor
public class VisionModelEngineProvider implements EngineProvider {

    public static final String ENGINE_NAME = "qwen-vl";

    private final PromptTemplates promptTemplates;

    @Override
    public String engineName() {
        return ENGINE_NAME;
    }

    @Override
    public String displayName() {
        return "Qwen2.5-VL";
    }

    @Override
    public Map<String, Object> defaultOptions() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("provider", "openai");
        defaults.put("base-url", "http://localhost:1234/v1");
        defaults.put("model-name", "qwen/qwen2.5-vl-7b");
        defaults.put("api-key", "");
        defaults.put("temperature", 0.1);
        defaults.put("max-tokens", 50);
        defaults.put("prompt-template", PromptTemplates.DEFAULT_TEMPLATE);
        defaults.put("post-processing", true);
        defaults.put("request-timeout-seconds", 60);
        defaults.put("connection-check", true);
        return defaults;
    }

    @Override
    public RecognitionEngine create(EngineOptions options) {
        return new VisionModelEngine(ENGINE_NAME, options, promptTemplates);
    }
}
