package com.ocreval.core.engine;

import com.ocreval.common.dto.RecognitionOutcome;
import com.ocreval.common.exception.EngineInitializationException;
import com.ocreval.common.exception.OcrEvalException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 识别引擎模板：负责生命周期状态、耗时统计，以及把识别过程中的异常转换为失败结果。
 * <p>
 * 子类只需实现 {@link #doOpen()}、{@link #doRecognize(Path)} 与 {@link #doClose()}。
 */
@Slf4j
public abstract class AbstractRecognitionEngine implements RecognitionEngine {

    protected final String name;
    protected final EngineOptions options;

    private volatile boolean opened;

    protected AbstractRecognitionEngine(String name, EngineOptions options) {
        this.name = name;
        this.options = options;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public final synchronized void open() {
        if (opened) {
            return;
        }
        log.info("初始化识别引擎: {} ({})", name, engineType());
        try {
            doOpen();
        } catch (OcrEvalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EngineInitializationException("引擎 " + name + " 初始化失败: " + e.getMessage(), e);
        }
        opened = true;
        log.info("识别引擎 {} 初始化完成", name);
    }

    @Override
    public final RecognitionOutcome recognize(Path image) {
        String imagePath = image.toString();
        if (!opened) {
            return RecognitionOutcome.failure(imagePath, "engine " + name + " is not open", Duration.ZERO);
        }
        long start = System.nanoTime();
        try {
            String text = doRecognize(image);
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            log.debug("{} 识别 {} -> '{}' ({} ms)", name, image.getFileName(), text, latency.toMillis());
            return RecognitionOutcome.success(imagePath, text, latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RecognitionOutcome.failure(imagePath, "interrupted", Duration.ofNanos(System.nanoTime() - start));
        } catch (Exception e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            log.warn("{} 识别 {} 失败: {}", name, image.getFileName(), errorDetail(e));
            return RecognitionOutcome.failure(imagePath, errorDetail(e), latency);
        }
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", name);
        details.put("type", engineType());
        details.putAll(technicalDetails());
        return details;
    }

    @Override
    public final synchronized void close() {
        if (!opened) {
            return;
        }
        opened = false;
        try {
            doClose();
            log.info("识别引擎 {} 已关闭", name);
        } catch (RuntimeException e) {
            log.warn("关闭识别引擎 {} 时出错: {}", name, e.getMessage(), e);
        }
    }

    public boolean isOpen() {
        return opened;
    }

    protected abstract void doOpen();

    /**
     * @return 识别出的文本，可为空串
     */
    protected abstract String doRecognize(Path image) throws Exception;

    protected void doClose() {
    }

    /**
     * 引擎类型描述，例如 "本地 OCR" 或 "多模态大模型"。
     */
    protected abstract String engineType();

    /**
     * 子类补充的技术细节。
     */
    protected Map<String, Object> technicalDetails() {
        return Map.of();
    }

    private static String errorDetail(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e instanceof OcrEvalException ? message : e.getClass().getSimpleName() + ": " + message;
    }
}
