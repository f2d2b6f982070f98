package com.ocreval.cli;

import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.common.exception.EngineInitializationException;
import com.ocreval.core.compare.EngineComparator;
import com.ocreval.core.dataset.Dataset;
import com.ocreval.core.dataset.DatasetLoader;
import com.ocreval.core.engine.EngineProvider;
import com.ocreval.core.engine.RecognitionEngine;
import com.ocreval.core.engine.RecognitionEngineFactory;
import com.ocreval.core.service.EvaluationService;
import com.ocreval.report.config.ReportProperties;
import com.ocreval.report.service.ReportWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CompareCommandTest {

    private RecognitionEngineFactory engineFactory;
    private DatasetLoader datasetLoader;
    private EvaluationService evaluationService;
    private ReportWriter reportWriter;
    private CompareCommand command;
    private Dataset dataset;

    @BeforeEach
    void setUp() {
        engineFactory = mock(RecognitionEngineFactory.class);
        datasetLoader = mock(DatasetLoader.class);
        evaluationService = mock(EvaluationService.class);
        reportWriter = mock(ReportWriter.class);
        command = new CompareCommand(engineFactory, datasetLoader, evaluationService, new EngineComparator(),
                reportWriter, new ReportProperties());
        dataset = Dataset.builder().imagesDir(Path.of("data/images")).build();
        when(datasetLoader.load(any())).thenReturn(dataset);
    }

    @Test
    void ranksEnginesAndWritesComparison() {
        RecognitionEngine tesseract = engine("tesseract");
        RecognitionEngine qwen = engine("qwen-vl");
        EvaluationReport tesseractReport = CliFixtures.report("tesseract", 0.5);
        EvaluationReport qwenReport = CliFixtures.report("qwen-vl", 1.0);
        when(evaluationService.evaluate(tesseract, dataset)).thenReturn(tesseractReport);
        when(evaluationService.evaluate(qwen, dataset)).thenReturn(qwenReport);

        int code = command.run(new DefaultApplicationArguments("compare", "tesseract", "qwen-vl",
                "--output-dir=out", "--comparison-report=cmp"), List.of("tesseract", "qwen-vl"));

        assertThat(code).isZero();
        ArgumentCaptor<ComparisonResult> comparison = ArgumentCaptor.forClass(ComparisonResult.class);
        verify(reportWriter).writeComparison(comparison.capture(),
                eq(List.of(tesseractReport, qwenReport)), eq(Path.of("out")), eq("cmp"));
        assertThat(comparison.getValue().rankedEngineNames()).containsExactly("qwen-vl", "tesseract");
        assertThat(comparison.getValue().getEntries().get(1).getAccuracyDelta()).isEqualTo(-0.5);
    }

    @Test
    void enginesThatFailToInitialiseAreSkipped() {
        RecognitionEngine tesseract = engine("tesseract");
        RecognitionEngine qwen = engine("qwen-vl");
        RecognitionEngine other = engine("other");
        when(evaluationService.evaluate(tesseract, dataset)).thenReturn(CliFixtures.report("tesseract", 0.5));
        when(evaluationService.evaluate(qwen, dataset)).thenThrow(new EngineInitializationException("无法连接模型服务"));
        when(evaluationService.evaluate(other, dataset)).thenReturn(CliFixtures.report("other", 0.9));

        int code = command.run(new DefaultApplicationArguments("compare", "tesseract", "qwen-vl", "other"),
                List.of("tesseract", "qwen-vl", "other"));

        assertThat(code).isZero();
        ArgumentCaptor<ComparisonResult> comparison = ArgumentCaptor.forClass(ComparisonResult.class);
        verify(reportWriter).writeComparison(comparison.capture(), anyList(), eq(Path.of("data/reports")),
                eq("model_comparison"));
        assertThat(comparison.getValue().rankedEngineNames()).containsExactly("other", "tesseract");
    }

    @Test
    void fewerThanTwoSuccessfulRunsIsFatal() {
        RecognitionEngine tesseract = engine("tesseract");
        RecognitionEngine qwen = engine("qwen-vl");
        when(evaluationService.evaluate(tesseract, dataset)).thenReturn(CliFixtures.report("tesseract", 0.5));
        when(evaluationService.evaluate(qwen, dataset)).thenThrow(new EngineInitializationException("down"));

        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments("compare", "tesseract", "qwen-vl"),
                List.of("tesseract", "qwen-vl")))
                .isInstanceOf(EngineInitializationException.class);
        verifyNoInteractions(reportWriter);
    }

    @Test
    void modelConfigIsAppliedPerEngine() {
        RecognitionEngine tesseract = engine("tesseract");
        RecognitionEngine qwen = engine("qwen-vl");
        EngineProvider alias = mock(EngineProvider.class);
        when(alias.engineName()).thenReturn("qwen-vl");
        when(engineFactory.findProvider("qwen_vl")).thenReturn(alias);
        RecognitionEngine tunedQwen = mock(RecognitionEngine.class);
        when(engineFactory.create("qwen-vl", Map.of("temperature", 0.2))).thenReturn(tunedQwen);
        when(evaluationService.evaluate(tesseract, dataset)).thenReturn(CliFixtures.report("tesseract", 0.5));
        when(evaluationService.evaluate(tunedQwen, dataset)).thenReturn(CliFixtures.report("qwen-vl", 0.9));

        int code = command.run(new DefaultApplicationArguments("compare", "tesseract", "qwen-vl",
                        "--model-config={\"qwen_vl\": {\"temperature\": 0.2}}"),
                List.of("tesseract", "qwen-vl"));

        assertThat(code).isZero();
        verify(evaluationService).evaluate(tunedQwen, dataset);
        verify(evaluationService).evaluate(tesseract, dataset);
        verify(evaluationService, never()).evaluate(qwen, dataset);
    }

    @Test
    void modelConfigForEngineOutsideComparisonIsRejected() {
        engine("tesseract");
        engine("qwen-vl");
        engine("other");

        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments("compare", "tesseract", "qwen-vl",
                        "--model-config={\"other\": {}}"),
                List.of("tesseract", "qwen-vl")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("other");
        assertThatThrownBy(() -> command.engineOverrides("{\"qwen-vl\": 0.2}", Set.of("qwen-vl")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("模型配置 JSON 格式错误");
        verifyNoInteractions(evaluationService);
    }

    @Test
    void rejectsSingleOrDuplicateEngines() {
        engine("qwen-vl");
        EngineProvider provider = mock(EngineProvider.class);
        when(provider.engineName()).thenReturn("qwen-vl");
        when(engineFactory.findProvider("qwen_vl")).thenReturn(provider);

        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments("compare", "qwen-vl"),
                List.of("qwen-vl")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments("compare", "qwen-vl", "qwen_vl"),
                List.of("qwen-vl", "qwen_vl")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("qwen_vl");
        verifyNoInteractions(evaluationService);
    }

    private RecognitionEngine engine(String name) {
        EngineProvider provider = mock(EngineProvider.class);
        when(provider.engineName()).thenReturn(name);
        when(engineFactory.findProvider(name)).thenReturn(provider);
        RecognitionEngine engine = mock(RecognitionEngine.class);
        when(engine.name()).thenReturn(name);
        when(engineFactory.create(name, Map.of())).thenReturn(engine);
        return engine;
    }
}
