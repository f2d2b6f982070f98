package com.ocreval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OcrEvalApplicationTest {

    @Test
    void configOptionBecomesAdditionalConfigLocation() {
        String[] args = OcrEvalApplication.withConfigLocation(
                new String[]{"evaluate", "tesseract", "--config=conf/eval.yaml", "--verbose"});

        assertThat(args).containsExactly("evaluate", "tesseract",
                "--spring.config.additional-location=file:conf/eval.yaml", "--verbose");
    }
}
