package com.ocreval.core.compare;

import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.dto.RankedEngine;
import com.ocreval.common.exception.DatasetMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 多引擎对比：校验数据集一致后排名，并计算与第一名的差距。
 * <p>
 * 排名规则：总体准确率降序，其次完全匹配率降序，最后按引擎名升序；无数据的汇总排在最后。
 */
@Slf4j
@Component
public class EngineComparator {

    private static final int MISMATCH_SAMPLE_SIZE = 5;

    private static final Comparator<EvaluationSummary> RANKING =
            Comparator.comparing((EvaluationSummary s) -> !s.hasData())
                    .thenComparing(EvaluationSummary::getOverallAccuracy,
                            Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(EvaluationSummary::getExactMatchRate,
                            Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(EvaluationSummary::getEngineName);

    public ComparisonResult compare(List<EvaluationSummary> summaries) {
        if (summaries == null || summaries.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个评估汇总才能对比");
        }
        Set<String> names = new HashSet<>();
        for (EvaluationSummary summary : summaries) {
            if (!names.add(summary.getEngineName())) {
                throw new IllegalArgumentException("引擎名称重复: " + summary.getEngineName());
            }
        }
        checkSameImageSet(summaries);

        List<EvaluationSummary> ranked = new ArrayList<>(summaries);
        ranked.sort(RANKING);
        EvaluationSummary top = ranked.get(0);

        ComparisonResult.ComparisonResultBuilder result = ComparisonResult.builder();
        for (int i = 0; i < ranked.size(); i++) {
            EvaluationSummary summary = ranked.get(i);
            boolean comparable = top.hasData() && summary.hasData();
            result.entry(RankedEngine.builder()
                    .rank(i + 1)
                    .engineName(summary.getEngineName())
                    .summary(summary)
                    .accuracyDelta(comparable ? summary.getOverallAccuracy() - top.getOverallAccuracy() : null)
                    .exactMatchRateDelta(comparable ? summary.getExactMatchRate() - top.getExactMatchRate() : null)
                    .build());
        }

        ComparisonResult comparison = result.build();
        log.info("对比完成，排名: {}", comparison.rankedEngineNames());
        return comparison;
    }

    private void checkSameImageSet(List<EvaluationSummary> summaries) {
        EvaluationSummary reference = summaries.get(0);
        for (EvaluationSummary other : summaries.subList(1, summaries.size())) {
            if (reference.getImagePaths().equals(other.getImagePaths())) {
                continue;
            }
            SortedSet<String> onlyInReference = new TreeSet<>(reference.getImagePaths());
            onlyInReference.removeAll(other.getImagePaths());
            SortedSet<String> onlyInOther = new TreeSet<>(other.getImagePaths());
            onlyInOther.removeAll(reference.getImagePaths());
            throw new DatasetMismatchException(String.format(
                    "引擎 %s 与 %s 的评估图片集合不一致: 仅在 %s 中 %d 张 %s, 仅在 %s 中 %d 张 %s",
                    reference.getEngineName(), other.getEngineName(),
                    reference.getEngineName(), onlyInReference.size(), sample(onlyInReference),
                    other.getEngineName(), onlyInOther.size(), sample(onlyInOther)));
        }
    }

    private static String sample(SortedSet<String> paths) {
        return paths.stream().limit(MISMATCH_SAMPLE_SIZE).collect(Collectors.joining(", ", "[", "]"));
    }
}
