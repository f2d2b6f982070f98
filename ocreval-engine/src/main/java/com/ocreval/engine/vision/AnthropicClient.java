package com.ocreval.engine.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ocreval.common.exception.EngineInitializationException;
import com.ocreval.common.exception.RecognitionException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

/**
 * Anthropic Messages API 视觉能力实现。
 */
@Slf4j
public class AnthropicClient implements VisionModelClient {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");
    private static final String API_VERSION = "2023-06-01";

    private final OkHttpClient httpClient;
    private final VisionRequestSettings settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public AnthropicClient(OkHttpClient httpClient, VisionRequestSettings settings) {
        this.httpClient = httpClient;
        this.settings = settings;
    }

    @Override
    public String complete(String imageBase64, String mimeType, String prompt) {
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("model", settings.getModelName());
            root.put("max_tokens", settings.getMaxTokens());
            root.put("temperature", settings.getTemperature());

            ArrayNode messages = root.putArray("messages");

            // 用户消息
            ObjectNode userMsg = messages.addObject();
            userMsg.put("role", "user");
            ArrayNode content = userMsg.putArray("content");

            // 图片部分（Anthropic 格式）
            ObjectNode imagePart = content.addObject();
            imagePart.put("type", "image");
            ObjectNode source = imagePart.putObject("source");
            source.put("type", "base64");
            source.put("media_type", mimeType);
            source.put("data", imageBase64);

            // 文字部分
            ObjectNode textPart = content.addObject();
            textPart.put("type", "text");
            textPart.put("text", prompt);

            Request request = headers(new Request.Builder())
                    .url(settings.endpoint("/messages"))
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    log.error("Anthropic API 调用失败: {} - {}", response.code(), body);
                    throw new RecognitionException("Anthropic API returned HTTP " + response.code());
                }

                JsonNode json = objectMapper.readTree(body);
                JsonNode contentArray = json.path("content");
                StringBuilder result = new StringBuilder();
                if (contentArray.isArray()) {
                    for (JsonNode block : contentArray) {
                        if ("text".equals(block.path("type").asText())) {
                            result.append(block.path("text").asText());
                        }
                    }
                }

                log.debug("Anthropic 响应长度: {} 字符", result.length());
                return result.toString();
            }

        } catch (IOException e) {
            throw new RecognitionException("network error calling Anthropic API: " + e.getMessage(), e);
        }
    }

    @Override
    public void checkConnection() {
        Request request = headers(new Request.Builder())
                .url(settings.endpoint("/models"))
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new EngineInitializationException("Anthropic API 连接检查失败: HTTP " + response.code());
            }
            log.info("Anthropic API 连接正常");
        } catch (IOException e) {
            throw new EngineInitializationException("无法连接 Anthropic API: " + e.getMessage(), e);
        }
    }

    private Request.Builder headers(Request.Builder builder) {
        if (settings.hasApiKey()) {
            builder.addHeader("x-api-key", settings.getApiKey());
        }
        return builder.addHeader("anthropic-version", API_VERSION);
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }
}
