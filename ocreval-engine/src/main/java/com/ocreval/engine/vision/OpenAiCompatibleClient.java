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
 * OpenAI 兼容 API 实现（OpenAI、LM Studio、vLLM 等）。
 */
@Slf4j
public class OpenAiCompatibleClient implements VisionModelClient {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final VisionRequestSettings settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiCompatibleClient(OkHttpClient httpClient, VisionRequestSettings settings) {
        this.httpClient = httpClient;
        this.settings = settings;
    }

    @Override
    public String complete(String imageBase64, String mimeType, String prompt) {
        Request.Builder request = new Request.Builder()
                .url(settings.endpoint("/chat/completions"))
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(buildRequestBody(imageBase64, mimeType, prompt), JSON_MEDIA));
        authorize(request);

        try (Response response = httpClient.newCall(request.build()).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                log.error("OpenAI 兼容接口调用失败: {} - {}", response.code(), body);
                throw new RecognitionException("model server returned HTTP " + response.code());
            }

            JsonNode json = objectMapper.readTree(body);
            JsonNode content = json.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new RecognitionException("model server returned no message content");
            }

            String result = content.asText();
            log.debug("OpenAI 兼容接口响应长度: {} 字符", result.length());
            return result;
        } catch (IOException e) {
            throw new RecognitionException("network error calling model server: " + e.getMessage(), e);
        }
    }

    @Override
    public void checkConnection() {
        Request.Builder request = new Request.Builder().url(settings.endpoint("/models")).get();
        authorize(request);

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new EngineInitializationException("模型服务连接检查失败: HTTP " + response.code()
                        + " (" + settings.getBaseUrl() + ")");
            }
            String body = response.body() != null ? response.body().string() : "";
            JsonNode models = objectMapper.readTree(body).path("data");
            boolean found = false;
            if (models.isArray()) {
                for (JsonNode model : models) {
                    if (settings.getModelName().equals(model.path("id").asText())) {
                        found = true;
                        break;
                    }
                }
            }
            if (found) {
                log.info("模型服务连接正常，已找到模型 {}", settings.getModelName());
            } else {
                log.warn("模型服务连接正常，但模型列表中没有 {}，请确认模型已加载", settings.getModelName());
            }
        } catch (IOException e) {
            throw new EngineInitializationException("无法连接模型服务 " + settings.getBaseUrl() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 构建 Chat Completions 请求体。
     */
    String buildRequestBody(String imageBase64, String mimeType, String prompt) {
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("model", settings.getModelName());
            root.put("max_tokens", settings.getMaxTokens());
            root.put("temperature", settings.getTemperature());

            ArrayNode messages = root.putArray("messages");

            ObjectNode userMsg = messages.addObject();
            userMsg.put("role", "user");
            ArrayNode content = userMsg.putArray("content");

            // 文字部分
            ObjectNode textPart = content.addObject();
            textPart.put("type", "text");
            textPart.put("text", prompt);

            // 图片部分
            ObjectNode imagePart = content.addObject();
            imagePart.put("type", "image_url");
            ObjectNode imageUrl = imagePart.putObject("image_url");
            imageUrl.put("url", "data:" + mimeType + ";base64," + imageBase64);

            return objectMapper.writeValueAsString(root);
        } catch (IOException e) {
            throw new RecognitionException("构建请求体失败", e);
        }
    }

    private void authorize(Request.Builder request) {
        if (settings.hasApiKey()) {
            request.addHeader("Authorization", "Bearer " + settings.getApiKey());
        }
    }

    @Override
    public String getProviderName() {
        return "openai";
    }
}
