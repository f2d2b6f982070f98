package com.ocreval.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.RankedEngine;
import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.common.exception.EngineInitializationException;
import com.ocreval.core.compare.EngineComparator;
import com.ocreval.core.dataset.Dataset;
import com.ocreval.core.dataset.DatasetLoader;
import com.ocreval.core.engine.RecognitionEngineFactory;
import com.ocreval.core.service.EvaluationService;
import com.ocreval.report.config.ReportProperties;
import com.ocreval.report.service.ReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code compare <engine> <engine>...}：依次评估多个引擎并生成对比报告。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompareCommand implements CliCommand {

    private static final TypeReference<Map<String, Map<String, Object>>> PER_ENGINE_TYPE = new TypeReference<>() {
    };

    private final RecognitionEngineFactory engineFactory;
    private final DatasetLoader datasetLoader;
    private final EvaluationService evaluationService;
    private final EngineComparator engineComparator;
    private final ReportWriter reportWriter;
    private final ReportProperties reportProperties;

    @Override
    public String name() {
        return "compare";
    }

    @Override
    public String usage() {
        return "compare <引擎> <引擎>... [--images-dir=DIR] [--output-dir=DIR] [--comparison-report=NAME]"
                + " [--model-config={\"引擎\": {JSON}}]";
    }

    @Override
    public int run(ApplicationArguments args, List<String> operands) {
        if (operands.size() < 2) {
            throw new ConfigurationException("至少需要指定两个引擎进行对比");
        }
        Set<String> seen = new HashSet<>();
        for (String engineName : operands) {
            String canonical = engineFactory.findProvider(engineName).engineName();
            if (!seen.add(canonical)) {
                throw new ConfigurationException("引擎重复: " + engineName);
            }
        }
        Map<String, Map<String, Object>> overrides = engineOverrides(
                CliOptions.value(args, "model-config", null), seen);
        Path imagesDir = Path.of(CliOptions.value(args, "images-dir", reportProperties.getImagesDir()));
        Path outputDir = Path.of(CliOptions.value(args, "output-dir", reportProperties.getOutputDir()));
        String reportName = CliOptions.value(args, "comparison-report", reportProperties.getComparisonReportName());

        log.info("开始模型对比评估: {}", String.join(", ", operands));
        Dataset dataset = datasetLoader.load(imagesDir);

        List<EvaluationReport> reports = new ArrayList<>();
        for (String engineName : operands) {
            log.info("评估引擎: {}", engineName);
            try {
                EvaluationReport report = evaluationService.evaluate(engineFactory.create(engineName,
                        overrides.getOrDefault(engineFactory.findProvider(engineName).engineName(), Map.of())), dataset);
                reports.add(report);
                log.info("  {} 完成: 准确率 {}", report.getEngineName(),
                        EvaluateCommand.ratio(report.getSummary().getOverallAccuracy()));
            } catch (EngineInitializationException e) {
                log.warn("  {} 初始化失败，已跳过: {}", engineName, e.getMessage());
            }
        }
        if (reports.size() < 2) {
            throw new EngineInitializationException("成功完成评估的引擎不足两个（" + reports.size() + "），无法对比");
        }

        ComparisonResult comparison = engineComparator.compare(
                reports.stream().map(EvaluationReport::getSummary).toList());
        List<Path> files = reportWriter.writeComparison(comparison, reports, outputDir, reportName);

        log.info("模型对比摘要:");
        for (RankedEngine entry : comparison.getEntries()) {
            log.info("  {}. {}: 准确率 {}, 匹配率 {}", entry.getRank(), entry.getEngineName(),
                    EvaluateCommand.ratio(entry.getSummary().getOverallAccuracy()),
                    EvaluateCommand.ratio(entry.getSummary().getExactMatchRate()));
        }
        files.forEach(f -> log.info("对比报告: {}", f));
        return 0;
    }

    /**
     * 按引擎名拆分的选项覆盖，形如 {@code {"qwen-vl": {"temperature": 0.2}}}，键归一化为引擎名。
     */
    Map<String, Map<String, Object>> engineOverrides(String json, Set<String> comparedEngines) {
        Map<String, Map<String, Object>> byEngine = new HashMap<>();
        CliOptions.modelConfig(json, PER_ENGINE_TYPE).forEach((name, options) -> {
            String canonical = engineFactory.findProvider(name).engineName();
            if (!comparedEngines.contains(canonical)) {
                throw new ConfigurationException("模型配置中的引擎未参与对比: " + name);
            }
            byEngine.put(canonical, options == null ? Map.of() : options);
        });
        return byEngine;
    }
}
