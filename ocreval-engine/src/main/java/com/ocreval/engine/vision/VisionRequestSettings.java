package com.ocreval.engine.vision;

import lombok.Builder;
import lombok.Value;

/**
 * 单个多模态模型服务的请求参数。
 */
@Value
@Builder
public class VisionRequestSettings {

    String baseUrl;

    String modelName;

    /** 本地服务（如 LM Studio）可以为空 */
    String apiKey;

    double temperature;

    int maxTokens;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * 去掉结尾斜杠后拼接路径。
     */
    public String endpoint(String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + path;
    }
}
