package com.ocreval.core.engine;

import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.core.config.EngineCatalogProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognitionEngineFactoryTest {

    private final AtomicReference<EngineOptions> received = new AtomicReference<>();
    private EngineCatalogProperties catalog;
    private RecognitionEngineFactory factory;

    @BeforeEach
    void setUp() {
        catalog = new EngineCatalogProperties();
        factory = new RecognitionEngineFactory(List.of(provider("qwen-vl"), provider("tesseract")), catalog);
    }

    @Test
    void lookupIgnoresUnderscoreAndCase() {
        RecognitionEngine engine = factory.create("Qwen_VL", null);

        assertThat(engine.name()).isEqualTo("qwen-vl");
    }

    @Test
    void optionsMergeDefaultsConfigurationAndOverrides() {
        catalog.getEngines().put("qwen-vl", Map.of("model-name", "from-config", "temperature", 0.2));

        factory.create("qwen-vl", Map.of("temperature", 0.7));

        EngineOptions options = received.get();
        assertThat(options.getString("model-name", null)).isEqualTo("from-config");
        assertThat(options.getDouble("temperature", 0)).isEqualTo(0.7);
        assertThat(options.getInt("max-tokens", 0)).isEqualTo(50);
    }

    @Test
    void unknownEngineListsAvailableOnes() {
        assertThatThrownBy(() -> factory.create("paddle", null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("qwen-vl, tesseract");
    }

    @Test
    void availableEnginesAreSorted() {
        assertThat(factory.availableEngines()).containsExactly("qwen-vl", "tesseract");
    }

    private EngineProvider provider(String name) {
        return new EngineProvider() {
            @Override
            public String engineName() {
                return name;
            }

            @Override
            public String displayName() {
                return name.toUpperCase();
            }

            @Override
            public Map<String, Object> defaultOptions() {
                return Map.of("model-name", "default", "max-tokens", 50);
            }

            @Override
            public RecognitionEngine create(EngineOptions options) {
                received.set(options);
                return new StubRecognitionEngine(name);
            }
        };
    }
}
