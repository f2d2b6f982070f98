package com.ocreval;

import com.ocreval.cli.OcrEvalRunner;
import com.ocreval.core.engine.RecognitionEngineFactory;
import com.ocreval.dispatcher.ratelimit.NoOpRateLimiter;
import com.ocreval.dispatcher.ratelimit.RateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(args = "--help")
class OcrEvalApplicationContextTest {

    @Autowired
    private OcrEvalRunner runner;

    @Autowired
    private RecognitionEngineFactory engineFactory;

    @Autowired
    private RateLimiter rateLimiter;

    @Test
    void wiresAllModules() {
        assertThat(runner.getExitCode()).isZero();
        assertThat(engineFactory.availableEngines()).containsExactly("qwen-vl", "tesseract");
        assertThat(engineFactory.effectiveOptions("qwen_vl").getString("base-url", null))
                .isEqualTo("http://localhost:1234/v1");
        assertThat(rateLimiter).isInstanceOf(NoOpRateLimiter.class);
    }
}
