package com.ocreval.core.metric;

import com.ocreval.common.dto.AccuracyBucket;
import com.ocreval.common.dto.EvaluationRecord;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.dto.FailureEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 汇总评估记录为数据集级别的统计。
 * <p>
 * 平均准确率用精确的十进制求和，输入顺序不同结果也完全一致。
 */
@Component
public class SummaryAggregator {

    public EvaluationSummary aggregate(String engineName, List<EvaluationRecord> records) {
        Map<String, Integer> distribution = AccuracyBucket.emptyDistribution();
        EvaluationSummary.EvaluationSummaryBuilder summary = EvaluationSummary.builder()
                .engineName(engineName)
                .totalImages(records.size());

        int succeeded = 0;
        int exactMatches = 0;
        BigDecimal accuracySum = BigDecimal.ZERO;
        for (EvaluationRecord record : records) {
            if (record.getOutcome().isSucceeded()) {
                succeeded++;
            } else {
                summary.failure(FailureEntry.builder()
                        .imagePath(record.getImagePath())
                        .errorDetail(record.getOutcome().getErrorDetail())
                        .build());
            }
            if (record.isExactMatch()) {
                exactMatches++;
            }
            accuracySum = accuracySum.add(new BigDecimal(record.getAccuracy()));
            distribution.merge(AccuracyBucket.of(record.getAccuracy()).getLabel(), 1, Integer::sum);
            summary.imagePath(record.getImagePath());
        }

        if (!records.isEmpty()) {
            BigDecimal total = BigDecimal.valueOf(records.size());
            summary.overallAccuracy(accuracySum.divide(total, MathContext.DECIMAL128).doubleValue())
                    .exactMatchRate(exactMatches / (double) records.size());
        }

        return summary.succeededImages(succeeded)
                .exactMatchCount(exactMatches)
                .accuracyDistribution(distribution)
                .build();
    }

    /**
     * 按目录分组汇总，结果按目录名排序。
     */
    public Map<String, EvaluationSummary> aggregateByDirectory(String engineName, List<EvaluationRecord> records,
                                                               Function<EvaluationRecord, String> directoryOf) {
        Map<String, List<EvaluationRecord>> grouped = new TreeMap<>();
        for (EvaluationRecord record : records) {
            grouped.computeIfAbsent(directoryOf.apply(record), k -> new ArrayList<>()).add(record);
        }
        Map<String, EvaluationSummary> summaries = new LinkedHashMap<>();
        grouped.forEach((directory, group) -> summaries.put(directory, aggregate(engineName, group)));
        return summaries;
    }
}
