package com.ocreval.core.service;

import com.ocreval.common.dto.EvaluationRecord;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.dto.RecognitionOutcome;
import com.ocreval.common.exception.CallTimeoutException;
import com.ocreval.common.exception.EngineInitializationException;
import com.ocreval.common.exception.OcrEvalException;
import com.ocreval.common.util.IdGenerator;
import com.ocreval.core.config.EvaluationProperties;
import com.ocreval.core.dataset.Dataset;
import com.ocreval.core.dataset.DatasetEntry;
import com.ocreval.core.engine.RecognitionEngine;
import com.ocreval.core.metric.RecordEvaluator;
import com.ocreval.core.metric.SummaryAggregator;
import com.ocreval.dispatcher.service.DispatcherService;
import com.ocreval.image.service.ImageValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单个引擎在数据集上的完整评估流程：
 * 校验图片 -> 并发识别 -> 等待全部完成 -> 逐条评分 -> 汇总。
 * <p>
 * 多条标注共用同一张图片时，引擎只调用一次。无效图片直接记为失败、不调用引擎，
 * 保证所有引擎在同一图片集合上评分。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final ImageValidator imageValidator;
    private final DispatcherService dispatcherService;
    private final RecordEvaluator recordEvaluator;
    private final SummaryAggregator summaryAggregator;
    private final EvaluationProperties properties;

    public EvaluationReport evaluate(RecognitionEngine engine, Dataset dataset) {
        Instant startedAt = Instant.now();
        String engineName = engine.name();
        log.info("开始 {} 数据集评估: {}", engineName, dataset.getImagesDir());

        List<DatasetEntry> entries = new ArrayList<>();
        int excludedDifficult = 0;
        for (DatasetEntry entry : dataset.getEntries()) {
            if (properties.isExcludeDifficult() && entry.getGroundTruth().isDifficult()) {
                excludedDifficult++;
                continue;
            }
            entries.add(entry);
        }
        if (excludedDifficult > 0) {
            log.info("已排除 {} 条困难样本", excludedDifficult);
        }

        openEngine(engine);
        try {
            Map<String, RecognitionOutcome> outcomes = recognizeAll(engine, entries);

            List<EvaluationRecord> records = new ArrayList<>(entries.size());
            Map<String, String> directoryOf = new HashMap<>();
            for (DatasetEntry entry : entries) {
                EvaluationRecord record = recordEvaluator.evaluate(
                        entry.getGroundTruth(), outcomes.get(entry.getKey()), entry.getKey());
                records.add(record);
                directoryOf.put(entry.getKey(), entry.getDirectory());
                log.debug("图片: {}, 标准答案: {}, 识别结果: {}, 准确率: {}",
                        entry.getKey(), entry.getGroundTruth().getTranscription(),
                        record.getOutcome().getRecognizedText(), String.format("%.4f", record.getAccuracy()));
            }

            EvaluationSummary summary = summaryAggregator.aggregate(engineName, records);
            Instant finishedAt = Instant.now();
            EvaluationReport report = EvaluationReport.builder()
                    .runId(IdGenerator.runId(engineName))
                    .engineName(engineName)
                    .engineDetails(engine.describe())
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .elapsed(Duration.between(startedAt, finishedAt))
                    .averageLatencyMillis(averageLatencyMillis(outcomes.values()))
                    .summary(summary)
                    .directorySummaries(summaryAggregator.aggregateByDirectory(
                            engineName, records, r -> directoryOf.get(r.getImagePath())))
                    .records(records)
                    .parseErrors(dataset.getParseErrors())
                    .skippedLines(dataset.skippedLines())
                    .excludedDifficult(excludedDifficult)
                    .build();

            if (summary.hasData()) {
                log.info("{} 评估完成，总体准确率: {} ({}%), 完全匹配率: {}%",
                        engineName, String.format("%.4f", summary.getOverallAccuracy()),
                        String.format("%.2f", summary.getOverallAccuracy() * 100),
                        String.format("%.2f", summary.getExactMatchRate() * 100));
            } else {
                log.warn("{} 评估完成，但没有可评估的数据", engineName);
            }
            return report;
        } finally {
            engine.close();
        }
    }

    private void openEngine(RecognitionEngine engine) {
        try {
            engine.open();
        } catch (OcrEvalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EngineInitializationException("引擎 " + engine.name() + " 初始化失败: " + e.getMessage(), e);
        }
    }

    /**
     * 每张图片识别一次，返回 图片键 -> 识别结果。
     */
    private Map<String, RecognitionOutcome> recognizeAll(RecognitionEngine engine, List<DatasetEntry> entries) {
        Map<String, Path> distinctImages = new LinkedHashMap<>();
        entries.forEach(entry -> distinctImages.putIfAbsent(entry.getKey(), entry.getImageFile()));

        Map<String, RecognitionOutcome> outcomes = new HashMap<>();
        List<String> jobs = new ArrayList<>();
        distinctImages.forEach((key, file) -> {
            Optional<String> problem = imageValidator.validate(file);
            if (problem.isPresent()) {
                outcomes.put(key, RecognitionOutcome.failure(key, problem.get(), Duration.ZERO));
            } else {
                jobs.add(key);
            }
        });
        log.info("{} 张图片待识别, {} 张图片无效", jobs.size(), distinctImages.size() - jobs.size());

        List<RecognitionOutcome> results = dispatcherService.dispatchAll(engine.name(), jobs,
                key -> engine.recognize(distinctImages.get(key)).toBuilder().imagePath(key).build(),
                (key, error) -> fallbackOutcome(key, error));
        for (int i = 0; i < jobs.size(); i++) {
            outcomes.put(jobs.get(i), results.get(i));
        }
        return outcomes;
    }

    private static RecognitionOutcome fallbackOutcome(String key, Throwable error) {
        if (error instanceof CallTimeoutException) {
            return RecognitionOutcome.timeout(key, ((CallTimeoutException) error).getTimeout());
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return RecognitionOutcome.failure(key, detail, null);
    }

    private static Double averageLatencyMillis(Iterable<RecognitionOutcome> outcomes) {
        long count = 0;
        double totalMillis = 0;
        for (RecognitionOutcome outcome : outcomes) {
            if (outcome.isSucceeded() && outcome.getLatency() != null) {
                totalMillis += outcome.getLatency().toNanos() / 1_000_000.0;
                count++;
            }
        }
        return count == 0 ? null : totalMillis / count;
    }
}
