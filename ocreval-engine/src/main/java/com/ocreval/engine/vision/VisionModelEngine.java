package com.ocreval.engine.vision;

import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.common.util.ImageUtils;
import com.ocreval.core.engine.AbstractRecognitionEngine;
import com.ocreval.core.engine.EngineOptions;
import com.ocreval.engine.prompt.PromptTemplates;
import com.ocreval.engine.text.ResponseCleaner;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 多模态大模型识别引擎：把图片和提示词发给模型服务，清理回答后作为识别结果。
 * <p>
 * HTTP 连接池在 {@link #open()} 时创建，整个评估过程复用，{@link #close()} 时释放。
 */
@Slf4j
public class VisionModelEngine extends AbstractRecognitionEngine {

    private final PromptTemplates promptTemplates;
    private final OkHttpClient injectedClient;

    private OkHttpClient httpClient;
    private VisionModelClient client;
    private String prompt;

    public VisionModelEngine(String name, EngineOptions options, PromptTemplates promptTemplates) {
        this(name, options, promptTemplates, null);
    }

    VisionModelEngine(String name, EngineOptions options, PromptTemplates promptTemplates, OkHttpClient httpClient) {
        super(name, options);
        this.promptTemplates = promptTemplates;
        this.injectedClient = httpClient;
    }

    @Override
    protected void doOpen() {
        prompt = promptTemplates.resolve(options.getString("prompt-template", PromptTemplates.DEFAULT_TEMPLATE));
        httpClient = injectedClient != null ? injectedClient : new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(options.getInt("request-timeout-seconds", 60)))
                .writeTimeout(Duration.ofSeconds(10))
                .build();
        client = createClient(httpClient, settings());

        if (options.getBoolean("connection-check", true)) {
            client.checkConnection();
        } else {
            log.info("已跳过模型服务连接检查");
        }
    }

    @Override
    protected String doRecognize(Path image) throws Exception {
        String base64 = ImageUtils.toBase64(image);
        String raw = client.complete(base64, ImageUtils.getMimeType(image), prompt);
        String text = options.getBoolean("post-processing", true) ? ResponseCleaner.clean(raw) : raw.strip();
        log.debug("{} 原始响应: '{}' -> '{}'", name, raw, text);
        return text;
    }

    @Override
    protected void doClose() {
        if (httpClient != null && injectedClient == null) {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
        httpClient = null;
        client = null;
    }

    @Override
    protected String engineType() {
        return "多模态大模型";
    }

    @Override
    protected Map<String, Object> technicalDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", provider());
        details.put("model_name", options.getString("model-name", null));
        details.put("base_url", options.getString("base-url", null));
        details.put("temperature", options.getDouble("temperature", 0.1));
        details.put("max_tokens", options.getInt("max-tokens", 50));
        details.put("post_processing", options.getBoolean("post-processing", true));
        details.put("prompt_template", options.getString("prompt-template", PromptTemplates.DEFAULT_TEMPLATE));
        return details;
    }

    private VisionRequestSettings settings() {
        return VisionRequestSettings.builder()
                .baseUrl(options.getString("base-url", "http://localhost:1234/v1"))
                .modelName(options.getString("model-name", "qwen/qwen2.5-vl-7b"))
                .apiKey(options.getString("api-key", null))
                .temperature(options.getDouble("temperature", 0.1))
                .maxTokens(options.getInt("max-tokens", 50))
                .build();
    }

    private String provider() {
        return options.getString("provider", "openai").trim().toLowerCase(Locale.ROOT);
    }

    private VisionModelClient createClient(OkHttpClient http, VisionRequestSettings settings) {
        switch (provider()) {
            case "openai":
                return new OpenAiCompatibleClient(http, settings);
            case "anthropic":
                return new AnthropicClient(http, settings);
            default:
                throw new ConfigurationException("不支持的模型服务协议: " + provider() + "，可选: openai, anthropic");
        }
    }
}
