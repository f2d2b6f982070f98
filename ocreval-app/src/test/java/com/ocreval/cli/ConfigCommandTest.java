package com.ocreval.cli;

import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.core.config.EvaluationProperties;
import com.ocreval.core.engine.EngineOptions;
import com.ocreval.core.engine.EngineProvider;
import com.ocreval.core.engine.RecognitionEngineFactory;
import com.ocreval.dispatcher.config.DispatcherProperties;
import com.ocreval.image.config.ImageProperties;
import com.ocreval.report.config.ReportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConfigCommandTest {

    @TempDir
    Path tempDir;

    private final DispatcherProperties dispatcherProperties = new DispatcherProperties();
    private ConfigCommand command;

    @BeforeEach
    void setUp() {
        RecognitionEngineFactory engineFactory = mock(RecognitionEngineFactory.class);
        when(engineFactory.availableEngines()).thenReturn(List.of("tesseract"));
        when(engineFactory.effectiveOptions("tesseract"))
                .thenReturn(EngineOptions.of(Map.of("language", "chi_sim", "page-seg-mode", 7, "api_key", "sk-secret")));
        EngineProvider provider = mock(EngineProvider.class);
        when(provider.defaultOptions()).thenReturn(Map.of("language", "eng", "page-seg-mode", 7));
        when(engineFactory.findProvider("tesseract")).thenReturn(provider);

        dispatcherProperties.setMaxConcurrent(8);
        command = new ConfigCommand(new EvaluationProperties(), dispatcherProperties, new ImageProperties(),
                new ReportProperties(), engineFactory);
    }

    @Test
    @SuppressWarnings("unchecked")
    void showPrintsEffectiveConfigurationInKebabCase() {
        Map<String, Object> yaml = new Yaml().load(command.show(null));

        Map<String, Object> ocreval = (Map<String, Object>) yaml.get("ocreval");
        assertThat(ocreval).containsOnlyKeys("evaluation", "engines", "dispatcher", "image", "report");
        assertThat((Map<String, Object>) ocreval.get("dispatcher")).containsEntry("max-concurrent", 8);
        assertThat((Map<String, Object>) ocreval.get("evaluation"))
                .containsEntry("label-file-name", "Label.txt")
                .containsEntry("annotation-policy", "FIRST_WELL_FORMED");
        Map<String, Object> engines = (Map<String, Object>) ocreval.get("engines");
        assertThat((Map<String, Object>) engines.get("tesseract"))
                .containsEntry("language", "chi_sim")
                .containsEntry("api-key", "******");
    }

    @Test
    void showSingleKey() {
        assertThat(command.show("ocreval.engines.tesseract.language"))
                .isEqualTo("ocreval.engines.tesseract.language: chi_sim\n");
        assertThatThrownBy(() -> command.show("ocreval.nope"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ocreval.nope");
    }

    @Test
    @SuppressWarnings("unchecked")
    void generateWritesDefaults() throws IOException {
        Path output = command.generate(tempDir.resolve("conf/config.yaml"));

        Map<String, Object> yaml = new Yaml().load(Files.readString(output));
        Map<String, Object> ocreval = (Map<String, Object>) yaml.get("ocreval");
        assertThat((Map<String, Object>) ocreval.get("dispatcher")).containsEntry("max-concurrent", 2);
        Map<String, Object> engines = (Map<String, Object>) ocreval.get("engines");
        assertThat((Map<String, Object>) engines.get("tesseract")).containsEntry("language", "eng");
        assertThat((Map<String, Object>) ocreval.get("report")).containsEntry("output-dir", "data/reports");
    }
}
