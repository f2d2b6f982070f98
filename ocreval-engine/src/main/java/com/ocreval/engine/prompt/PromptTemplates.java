package com.ocreval.engine.prompt;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 多模态模型的 Prompt 模板。
 * <p>
 * 默认提示词从 classpath 下的 {@code prompts/text-extraction.md} 加载；
 * 引擎选项 {@code prompt-template} 可指向其他 classpath 资源，或以 {@code file:} 开头指向本地文件。
 */
@Slf4j
@Component
public class PromptTemplates {

    public static final String DEFAULT_TEMPLATE = "prompts/text-extraction.md";

    private static final String FILE_PREFIX = "file:";
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    @PostConstruct
    void loadDefault() {
        String prompt = resolve(DEFAULT_TEMPLATE);
        log.info("已加载默认 Prompt 模板 ({} 字符)", prompt.length());
    }

    /** 默认的文字提取 Prompt */
    public String getTextExtraction() {
        return resolve(DEFAULT_TEMPLATE);
    }

    /**
     * 按位置加载模板，结果会被缓存。
     */
    public String resolve(String location) {
        String target = location == null || location.isBlank() ? DEFAULT_TEMPLATE : location.trim();
        return cache.computeIfAbsent(target, PromptTemplates::loadPrompt);
    }

    private static String loadPrompt(String location) {
        Resource resource = location.startsWith(FILE_PREFIX)
                ? new FileSystemResource(location.substring(FILE_PREFIX.length()))
                : new ClassPathResource(location.startsWith(CLASSPATH_PREFIX)
                        ? location.substring(CLASSPATH_PREFIX.length()) : location);
        try {
            String content = resource.getContentAsString(StandardCharsets.UTF_8).strip();
            log.debug("加载 Prompt: {} ({} 字符)", location, content.length());
            return content;
        } catch (IOException e) {
            log.error("加载 Prompt 失败: {}", location, e);
            throw new IllegalStateException("无法加载 Prompt 文件: " + location, e);
        }
    }
}
