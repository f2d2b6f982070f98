package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 一次引擎评估运行的完整产出：汇总、分目录汇总、逐条记录与数据质量信息。
 */
@Value
@Builder
@Jacksonized
public class EvaluationReport {

    String runId;

    String engineName;

    /** 引擎公开的技术细节（模型名称、类型、配置、版本等） */
    @Singular
    Map<String, Object> engineDetails;

    Instant startedAt;

    Instant finishedAt;

    Duration elapsed;

    /** 成功调用的平均耗时（毫秒），没有耗时数据时为 null */
    Double averageLatencyMillis;

    EvaluationSummary summary;

    /** 标注目录 -> 该目录的汇总，按目录名排序 */
    @Singular
    Map<String, EvaluationSummary> directorySummaries;

    @Singular("evaluationRecord")
    List<EvaluationRecord> records;

    @Singular
    List<ManifestParseError> parseErrors;

    /** 标注文件中被跳过的行数 */
    int skippedLines;

    /** 按配置排除的困难样本数 */
    int excludedDifficult;
}
