package com.ocreval.engine.tesseract;

import com.ocreval.core.engine.EngineOptions;
import com.ocreval.core.engine.EngineProvider;
import com.ocreval.core.engine.RecognitionEngine;
import com.ocreval.image.service.ImagePreprocessor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tesseract 本地 OCR 引擎。
 */
@Component
@RequiredArgsConstructor
public class TesseractEngineProvider implements EngineProvider {

    public static final String ENGINE_NAME = "tesseract";

    private final ImagePreprocessor imagePreprocessor;

    @Override
    public String engineName() {
        return ENGINE_NAME;
    }

    @Override
    public String displayName() {
        return "Tesseract OCR";
    }

    @Override
    public Map<String, Object> defaultOptions() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("language", "eng");
        defaults.put("datapath", "");
        defaults.put("whitelist", "");
        defaults.put("page-seg-mode", 7);
        defaults.put("preprocess", true);
        defaults.put("min-confidence", 0);
        return defaults;
    }

    @Override
    public RecognitionEngine create(EngineOptions options) {
        return new TesseractEngine(ENGINE_NAME, options, imagePreprocessor);
    }
}
