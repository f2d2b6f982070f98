package com.ocreval.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.core.dataset.Dataset;
import com.ocreval.core.dataset.DatasetLoader;
import com.ocreval.core.engine.RecognitionEngine;
import com.ocreval.core.engine.RecognitionEngineFactory;
import com.ocreval.core.service.EvaluationService;
import com.ocreval.report.config.ReportFormat;
import com.ocreval.report.config.ReportProperties;
import com.ocreval.report.service.ReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code evaluate <engine>}：用一个引擎评估整个数据集并生成报告。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvaluateCommand implements CliCommand {

    private static final TypeReference<Map<String, Object>> OPTIONS_TYPE = new TypeReference<>() {
    };

    private final RecognitionEngineFactory engineFactory;
    private final DatasetLoader datasetLoader;
    private final EvaluationService evaluationService;
    private final ReportWriter reportWriter;
    private final ReportProperties reportProperties;

    @Override
    public String name() {
        return "evaluate";
    }

    @Override
    public String usage() {
        return "evaluate <引擎> [--images-dir=DIR] [--output-dir=DIR] [--model-config=JSON]"
                + " [--report-format=markdown|json|csv|both|all] [--report-name=NAME]";
    }

    @Override
    public int run(ApplicationArguments args, List<String> operands) {
        if (operands.size() != 1) {
            throw new ConfigurationException("evaluate 需要且只需要一个引擎名，可选: "
                    + String.join(", ", engineFactory.availableEngines()));
        }
        Path imagesDir = Path.of(CliOptions.value(args, "images-dir", reportProperties.getImagesDir()));
        Path outputDir = Path.of(CliOptions.value(args, "output-dir", reportProperties.getOutputDir()));
        ReportFormat format = ReportFormat.parse(
                CliOptions.value(args, "report-format", reportProperties.getFormat().name()));
        String reportName = CliOptions.value(args, "report-name", null);
        Map<String, Object> overrides = parseModelConfig(CliOptions.value(args, "model-config", null));

        RecognitionEngine engine = engineFactory.create(operands.get(0), overrides);
        Dataset dataset = datasetLoader.load(imagesDir);

        log.info("正在评估: 引擎={}, 图片目录={}", engine.name(), dataset.getImagesDir());
        EvaluationReport report = evaluationService.evaluate(engine, dataset);

        log.info("正在生成评估报告...");
        List<Path> files = reportWriter.writeEvaluation(report, outputDir, format, reportName);

        logSummary(report);
        log.info("生成的报告文件:");
        files.forEach(f -> log.info("  - {}", f));
        return 0;
    }

    Map<String, Object> parseModelConfig(String json) {
        return CliOptions.modelConfig(json, OPTIONS_TYPE);
    }

    private void logSummary(EvaluationReport report) {
        EvaluationSummary summary = report.getSummary();
        log.info("评估结果摘要:");
        log.info("  模型: {}", report.getEngineName());
        log.info("  总图片数: {} (失败 {})", summary.getTotalImages(), summary.failedImages());
        log.info("  总体准确率: {}", ratio(summary.getOverallAccuracy()));
        log.info("  完全匹配率: {}", ratio(summary.getExactMatchRate()));
        report.getDirectorySummaries().forEach((directory, s) ->
                log.info("  {}: {} 张图片, 准确率 {}", directory, s.getTotalImages(), ratio(s.getOverallAccuracy())));
    }

    static String ratio(Double value) {
        return value == null ? "无数据" : String.format(Locale.ROOT, "%.4f (%.2f%%)", value, value * 100);
    }
}
