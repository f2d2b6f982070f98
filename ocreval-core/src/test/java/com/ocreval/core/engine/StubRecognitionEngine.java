package com.ocreval.core.engine;

import com.ocreval.common.exception.RecognitionException;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用引擎：按文件名返回预设文本或抛出异常。
 */
public class StubRecognitionEngine extends AbstractRecognitionEngine {

    private final Map<String, String> answers = new HashMap<>();
    private final Map<String, String> failures = new HashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private boolean failOnOpen;
    private boolean closed;

    public StubRecognitionEngine(String name) {
        super(name, EngineOptions.empty());
    }

    public StubRecognitionEngine answer(String fileName, String text) {
        answers.put(fileName, text);
        return this;
    }

    public StubRecognitionEngine fail(String fileName, String detail) {
        failures.put(fileName, detail);
        return this;
    }

    public StubRecognitionEngine failOnOpen() {
        this.failOnOpen = true;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public boolean wasClosed() {
        return closed;
    }

    @Override
    protected void doOpen() {
        if (failOnOpen) {
            throw new IllegalStateException("model server unreachable");
        }
    }

    @Override
    protected String doRecognize(Path image) {
        calls.incrementAndGet();
        String fileName = image.getFileName().toString();
        if (failures.containsKey(fileName)) {
            throw new RecognitionException(failures.get(fileName));
        }
        return answers.getOrDefault(fileName, "");
    }

    @Override
    protected void doClose() {
        closed = true;
    }

    @Override
    protected String engineType() {
        return "stub";
    }

    @Override
    protected Map<String, Object> technicalDetails() {
        return Map.of("answers", answers.size());
    }
}
